package org.olympiac.compiler.frontend.semantics.analysis;

import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.semantics.VerificationContext;

/**
 * Interface for specialized handlers in verification.
 * Each handler is responsible for analyzing a specific kind of AST node and for visiting its
 * children at the point its rule requires: before computing a type, after declaring a name,
 * or inside a freshly entered scope.
 */
@FunctionalInterface
public interface IAnalysisHandler {
    /**
     * Analyzes a single AST node.
     * @param node The node to analyze.
     * @param context The verification state: symbol table, diagnostics and decorations.
     */
    void analyze(AstNode node, VerificationContext context);
}
