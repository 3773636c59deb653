package org.olympiac.compiler.frontend.semantics.analysis;

import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.parser.ast.NodeKind;
import org.olympiac.compiler.frontend.semantics.Decoration;
import org.olympiac.compiler.frontend.semantics.SymbolEntry;
import org.olympiac.compiler.frontend.semantics.TypeTag;
import org.olympiac.compiler.frontend.semantics.VerificationContext;

import java.util.List;
import java.util.Optional;

/**
 * Handles identifiers, both standing alone and inside expressions.
 * <p>
 * An unresolved name is reported as used before being declared, except below a syntax error
 * node. In the sequence {@code obj . method}, where {@code obj} resolves to a list, the method
 * name is a reference to the list and is not looked up itself.
 */
public class IdentifierAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, VerificationContext context) {
        String name = node.content();

        if (node.kind() == NodeKind.IDENTIFIER) {
            Optional<SymbolEntry> owner = methodOwner(node, context);
            if (owner.isPresent()) {
                context.decorate(node, Decoration.builder(TypeTag.UNKNOWN)
                        .with("methodOf", owner.get().name())
                        .build());
                return;
            }
        }

        Optional<SymbolEntry> entry = context.table().lookup(name);
        if (entry.isPresent()) {
            context.decorate(node, Decoration.builder(entry.get().type())
                    .with("ref", entry.get().toMap())
                    .build());
            return;
        }
        if (!context.insideSyntaxError()) {
            context.reportError("identifier '" + name + "' used before being declared", node);
        }
        context.decorate(node, Decoration.builder(TypeTag.UNKNOWN).with("ref", null).build());
    }

    private static Optional<SymbolEntry> methodOwner(AstNode node, VerificationContext context) {
        Optional<AstNode> parent = context.parent();
        if (parent.isEmpty()) {
            return Optional.empty();
        }
        List<AstNode> siblings = parent.get().getChildren();
        int index = context.position();
        if (index < 2) {
            return Optional.empty();
        }
        AstNode dot = siblings.get(index - 1);
        AstNode object = siblings.get(index - 2);
        if (dot.kind() != NodeKind.SYMBOL || !".".equals(dot.content()) || object.kind() != NodeKind.IDENTIFIER) {
            return Optional.empty();
        }
        return context.table().lookup(object.content()).filter(entry -> entry.type().isList());
    }
}
