package org.olympiac.compiler.frontend.semantics.analysis;

import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.semantics.Decoration;
import org.olympiac.compiler.frontend.semantics.TypeTag;
import org.olympiac.compiler.frontend.semantics.VerificationContext;

/**
 * Handles the scope-defining nodes: conditionals, their else branch and both loop forms.
 * A scope is entered before the children are analyzed and left afterwards, so names
 * declared inside are not visible once the construct ends.
 */
public class ScopeAnalysisHandler implements IAnalysisHandler {

    /**
     * {@inheritDoc}
     */
    @Override
    public void analyze(AstNode node, VerificationContext context) {
        int level = context.table().enterScope();
        try {
            context.visitChildren(node);
        } finally {
            context.table().exitScope();
        }
        Decoration.Builder decoration = Decoration.builder(TypeTag.VOID)
                .with("construct", node.kind().displayName())
                .with("scopeLevel", level);
        switch (node.kind()) {
            case LOOP -> decoration.with("count", node.attribute("count"));
            case CONDITIONAL, LOOP_UNTIL -> decoration.with("condition", node.stringAttribute("condition"));
            default -> { }
        }
        context.decorate(node, decoration.build());
    }
}
