package org.olympiac.compiler.frontend.semantics.analysis;

import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.semantics.Decoration;
import org.olympiac.compiler.frontend.semantics.TypeTag;
import org.olympiac.compiler.frontend.semantics.VerificationContext;

/**
 * Handles athlete declarations: the name is declared as {@code entity:Deportista} in the
 * current scope.
 */
public class AthleteAnalysisHandler implements IAnalysisHandler {

    static final TypeTag ATHLETE = TypeTag.entity("Deportista");

    @Override
    public void analyze(AstNode node, VerificationContext context) {
        String name = node.stringAttribute("name");
        context.declare(name, ATHLETE, node);
        context.decorate(node, Decoration.builder(ATHLETE).with("definition", name).build());
    }
}
