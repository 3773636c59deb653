package org.olympiac.compiler.frontend.semantics.analysis;

import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.semantics.VerificationContext;

/**
 * Handles nodes without a rule of their own (program root, comments, stray symbols, action
 * stubs, syntax errors). Only their children are analyzed; the node stays undecorated.
 */
public class PassThroughAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, VerificationContext context) {
        context.visitChildren(node);
    }
}
