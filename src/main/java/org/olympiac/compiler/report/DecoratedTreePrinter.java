package org.olympiac.compiler.report;

import org.olympiac.compiler.diagnostics.Diagnostic;
import org.olympiac.compiler.frontend.parser.ast.AstPrinter;
import org.olympiac.compiler.frontend.parser.ast.SyntaxTree;
import org.olympiac.compiler.frontend.semantics.VerificationResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Prints a tree in preorder with a {@code decorated: {...}} line under every decorated node,
 * followed by the semantic errors.
 */
public final class DecoratedTreePrinter {

    private DecoratedTreePrinter() {}

    public static List<String> render(SyntaxTree tree, VerificationResult verification) {
        List<String> lines = new ArrayList<>(AstPrinter.preorderLines(tree.root(),
                node -> verification.decorations().get(node)
                        .map(decoration -> "decorated: " + decoration.toMap())
                        .orElse(null)));
        lines.add("");
        if (verification.errors().isEmpty()) {
            lines.add("No semantic errors.");
        } else {
            lines.add("Semantic errors:");
            for (Diagnostic error : verification.errors()) {
                lines.add("  " + error);
            }
        }
        return lines;
    }
}
