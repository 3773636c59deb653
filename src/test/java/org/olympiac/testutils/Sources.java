package org.olympiac.testutils;

import org.olympiac.compiler.Compiler;
import org.olympiac.compiler.api.CompilationResult;
import org.olympiac.compiler.api.FrontendOptions;
import org.olympiac.compiler.diagnostics.Diagnostic;
import org.olympiac.compiler.diagnostics.DiagnosticsEngine;
import org.olympiac.compiler.frontend.lexer.Lexer;
import org.olympiac.compiler.frontend.lexer.Token;
import org.olympiac.compiler.frontend.parser.Parser;
import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.parser.ast.NodeKind;
import org.olympiac.compiler.frontend.parser.ast.SyntaxTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Shortcuts for running the front end on inline source lines in tests.
 */
public final class Sources {

    private Sources() {}

    public static List<Token> tokens(String... lines) {
        return new Lexer(List.of(lines), new DiagnosticsEngine()).scanTokens();
    }

    public static SyntaxTree parse(String... lines) {
        return new Parser(tokens(lines)).parse();
    }

    public static SyntaxTree parse(FrontendOptions options, String... lines) {
        return new Parser(tokens(lines), options).parse();
    }

    public static CompilationResult compile(String... lines) {
        return new Compiler().compile(List.of(lines));
    }

    /**
     * Collects every node of the given kind below (and including) {@code root}, in preorder.
     */
    public static List<AstNode> findAll(AstNode root, NodeKind kind) {
        List<AstNode> found = new ArrayList<>();
        collect(root, kind, found);
        return found;
    }

    public static AstNode findFirst(AstNode root, NodeKind kind) {
        List<AstNode> found = findAll(root, kind);
        if (found.isEmpty()) {
            throw new AssertionError("No " + kind.displayName() + " node in tree");
        }
        return found.get(0);
    }

    public static List<String> messages(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(Diagnostic::message).toList();
    }

    private static void collect(AstNode node, NodeKind kind, List<AstNode> out) {
        if (node.kind() == kind) {
            out.add(node);
        }
        for (AstNode child : node.getChildren()) {
            collect(child, kind, out);
        }
    }
}
