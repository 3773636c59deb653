package org.olympiac.compiler.frontend.semantics.analysis;

import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.parser.ast.NodeKind;
import org.olympiac.compiler.frontend.semantics.Decoration;
import org.olympiac.compiler.frontend.semantics.TypeTag;
import org.olympiac.compiler.frontend.semantics.VerificationContext;

/**
 * Handles matches, races, routines and combats. Both endpoints must be present (the two
 * countries of a match, the closing keyword of the other forms) and exactly one result must
 * precede the end.
 */
public class CompetitionAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, VerificationContext context) {
        context.visitChildren(node);

        String label = node.kind().displayName() + " '" + node.content() + "'";
        if (node.kind() == NodeKind.MATCH) {
            if (node.stringAttribute("home") == null) {
                context.reportError(label + " is missing its first country", node);
            }
            if (node.stringAttribute("away") == null) {
                context.reportError(label + " is missing its second country", node);
            }
        } else if (!node.flag("closed")) {
            context.reportError(label + " is missing its closing '" + node.stringAttribute("end") + "'", node);
        }

        int results = 0;
        boolean complete = false;
        for (AstNode child : node.getChildren()) {
            if (child.kind() == NodeKind.RESULT) {
                results++;
                complete = child.flag("complete");
            }
        }
        if (results != 1) {
            context.reportError(label + " must have exactly one result; found " + results, node);
        }
        context.decorate(node, Decoration.builder(TypeTag.VOID)
                .with("results", results)
                .with("complete", results == 1 && complete)
                .build());
    }
}
