package org.olympiac.compiler.api;

import org.olympiac.compiler.diagnostics.Diagnostic;
import org.olympiac.compiler.frontend.lexer.Token;
import org.olympiac.compiler.frontend.parser.ast.SyntaxTree;
import org.olympiac.compiler.frontend.semantics.VerificationResult;

import java.util.ArrayList;
import java.util.List;

/**
 * The output of the front end for one program.
 *
 * @param tokens The scanned tokens.
 * @param lexicalErrors Characters the scanner could not classify.
 * @param tree The syntax tree with its syntax diagnostics.
 * @param verification The decorations, semantic diagnostics and final symbol table.
 */
public record CompilationResult(
        List<Token> tokens,
        List<Diagnostic> lexicalErrors,
        SyntaxTree tree,
        VerificationResult verification
) {
    public CompilationResult {
        tokens = List.copyOf(tokens);
        lexicalErrors = List.copyOf(lexicalErrors);
    }

    /**
     * @return Lexical, syntax and semantic diagnostics, in that order.
     */
    public List<Diagnostic> allDiagnostics() {
        List<Diagnostic> all = new ArrayList<>(lexicalErrors);
        all.addAll(tree.syntaxErrors());
        all.addAll(verification.errors());
        return all;
    }

    /**
     * @return true if any phase reported an error (warnings do not count).
     */
    public boolean hasErrors() {
        return allDiagnostics().stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }
}
