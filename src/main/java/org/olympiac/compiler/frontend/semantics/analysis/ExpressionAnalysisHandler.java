package org.olympiac.compiler.frontend.semantics.analysis;

import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.semantics.Decoration;
import org.olympiac.compiler.frontend.semantics.TypeTag;
import org.olympiac.compiler.frontend.semantics.VerificationContext;

import java.util.List;
import java.util.Set;

/**
 * Infers the types of literals and operators.
 * <p>
 * Operands are analyzed first. Arithmetic on two ints is an {@code int} and {@code +} on two
 * strings is a {@code string}. {@code +} across text and a number is an error typed
 * {@code unknown}. Every other combination is {@code unknown} without an error.
 */
public class ExpressionAnalysisHandler implements IAnalysisHandler {

    private static final Set<String> ARITHMETIC = Set.of("+", "-", "*", "/", "%");

    @Override
    public void analyze(AstNode node, VerificationContext context) {
        switch (node.kind()) {
            case NUMBER -> context.decorate(node, Decoration.builder(TypeTag.INT)
                    .with("value", node.attribute("value")).build());
            case TEXT -> context.decorate(node, Decoration.builder(TypeTag.STRING)
                    .with("value", node.attribute("value")).build());
            case BOOLEAN -> context.decorate(node, Decoration.builder(TypeTag.BOOL)
                    .with("value", node.attribute("value")).build());
            case TIE -> context.decorate(node, Decoration.of(TypeTag.BOOL));
            case UNARY_OP -> unary(node, context);
            case BINARY_OP -> binary(node, context);
            default -> throw new IllegalStateException("Not an expression node: " + node.kind());
        }
    }

    private void unary(AstNode node, VerificationContext context) {
        context.visitChildren(node);
        List<AstNode> children = node.getChildren();
        TypeTag operand = children.isEmpty() ? TypeTag.UNKNOWN : context.typeOf(children.get(0));
        TypeTag type = TypeTag.INT.equals(operand) ? TypeTag.INT : TypeTag.UNKNOWN;
        context.decorate(node, Decoration.builder(type)
                .with("operator", node.content())
                .with("operand", operand.toString())
                .build());
    }

    private void binary(AstNode node, VerificationContext context) {
        context.visitChildren(node);
        List<AstNode> children = node.getChildren();
        if (children.size() < 2) {
            context.decorate(node, Decoration.of(TypeTag.UNKNOWN));
            return;
        }
        TypeTag left = context.typeOf(children.get(0));
        TypeTag right = context.typeOf(children.get(1));
        String operator = node.content();

        TypeTag type;
        if (TypeTag.INT.equals(left) && TypeTag.INT.equals(right) && ARITHMETIC.contains(operator)) {
            type = TypeTag.INT;
        } else if (TypeTag.STRING.equals(left) && TypeTag.STRING.equals(right) && operator.equals("+")) {
            type = TypeTag.STRING;
        } else {
            if (operator.equals("+") && (TypeTag.STRING.equals(left) && TypeTag.INT.equals(right)
                    || TypeTag.INT.equals(left) && TypeTag.STRING.equals(right))) {
                context.reportError("cannot add text and number", node);
            }
            type = TypeTag.UNKNOWN;
        }
        context.decorate(node, Decoration.builder(type)
                .with("operator", operator)
                .with("left", left.toString())
                .with("right", right.toString())
                .build());
    }
}
