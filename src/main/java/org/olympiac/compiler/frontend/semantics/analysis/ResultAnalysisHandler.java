package org.olympiac.compiler.frontend.semantics.analysis;

import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.semantics.Decoration;
import org.olympiac.compiler.frontend.semantics.TypeTag;
import org.olympiac.compiler.frontend.semantics.VerificationContext;

import java.util.Optional;

/**
 * Handles {@code Resultado a - b}: both scores must be present. Each missing score is
 * reported on its own, and a result inside a competition names the competition.
 */
public class ResultAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, VerificationContext context) {
        Integer home = node.intAttribute("home");
        Integer away = node.intAttribute("away");
        Optional<AstNode> competition = context.parent().filter(parent -> parent.kind().isCompetition());

        String prefix = competition
                .map(c -> "incomplete result in " + c.kind().displayName() + " '" + c.content() + "': ")
                .orElse("incomplete result: ");
        if (home == null) {
            context.reportError(prefix + "missing first number", node);
        }
        if (away == null) {
            context.reportError(prefix + "missing second number", node);
        }
        context.decorate(node, Decoration.builder(TypeTag.VOID)
                .with("home", home)
                .with("away", away)
                .with("complete", home != null && away != null)
                .build());
    }
}
