package org.olympiac.compiler.frontend.semantics.analysis;

import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.parser.ast.NodeKind;
import org.olympiac.compiler.frontend.semantics.Decoration;
import org.olympiac.compiler.frontend.semantics.TypeTag;
import org.olympiac.compiler.frontend.semantics.VerificationContext;

/**
 * Handles list declarations and bulk loads.
 * A named list is declared as {@code list:<element>}. The athletes of a bulk load are data,
 * not declarations, so only their count is recorded.
 */
public class ListAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, VerificationContext context) {
        TypeTag type = TypeTag.list(node.stringAttribute("type"));
        String name = node.stringAttribute("name");
        if (name != null) {
            context.declare(name, type, node);
        }
        Decoration.Builder decoration = Decoration.builder(type).with("name", name);
        if (node.kind() == NodeKind.BULK_LOAD) {
            Integer count = node.intAttribute("count");
            decoration.with("count", count == null ? 0 : count);
        }
        context.decorate(node, decoration.build());
        context.visitChildren(node);
    }
}
