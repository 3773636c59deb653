package org.olympiac.compiler.frontend.parser.features.expression;

import org.olympiac.compiler.frontend.lexer.Token;
import org.olympiac.compiler.frontend.lexer.TokenType;
import org.olympiac.compiler.frontend.parser.ParsingContext;
import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.parser.ast.NodeKind;
import org.olympiac.compiler.frontend.parser.features.invocation.InvocationHandler;

/**
 * Precedence-climbing parser for conditions and arithmetic.
 * Levels from loosest to tightest: comparison, additive, multiplicative, unary, primary.
 * All binary levels are left associative.
 */
public class ExpressionParser {

    private final InvocationHandler invocationHandler = new InvocationHandler();

    /**
     * Parses one expression at the cursor.
     * @param context The parsing context.
     * @return The expression node, or a {@code SyntaxError} node if no expression starts here.
     */
    public AstNode parse(ParsingContext context) {
        return comparison(context);
    }

    private AstNode comparison(ParsingContext context) {
        AstNode left = additive(context);
        while (context.check(TokenType.COMPARISON_OPERATOR)) {
            Token operator = context.advance();
            left = binary(context, operator, left, additive(context));
        }
        return left;
    }

    private AstNode additive(ParsingContext context) {
        AstNode left = multiplicative(context);
        while (isArithmetic(context.peek(), "+", "-")) {
            Token operator = context.advance();
            left = binary(context, operator, left, multiplicative(context));
        }
        return left;
    }

    private AstNode multiplicative(ParsingContext context) {
        AstNode left = unary(context);
        while (isArithmetic(context.peek(), "*", "/", "%")) {
            Token operator = context.advance();
            left = binary(context, operator, left, unary(context));
        }
        return left;
    }

    private AstNode unary(ParsingContext context) {
        if (isArithmetic(context.peek(), "+", "-")) {
            Token operator = context.advance();
            AstNode operand = unary(context);
            return context.nodes().create(NodeKind.UNARY_OP, operator.text(), operator)
                    .put("operator", operator.text())
                    .addChild(operand);
        }
        return primary(context);
    }

    private AstNode primary(ParsingContext context) {
        Token token = context.peek();
        if (token == null) {
            context.reportError("Expected expression but reached end of input", null);
            return context.nodes().create(NodeKind.SYNTAX_ERROR, "expression", null);
        }
        switch (token.type()) {
            case INTEGER_LITERAL:
                context.advance();
                return number(context, token);
            case STRING_LITERAL:
                context.advance();
                String text = token.text();
                return context.nodes().create(NodeKind.TEXT, token.text(), token)
                        .put("value", text.substring(1, text.length() - 1));
            case BOOLEAN_LITERAL:
                context.advance();
                return context.nodes().create(NodeKind.BOOLEAN, token.text(), token)
                        .put("value", Boolean.parseBoolean(token.text()));
            case IDENTIFIER:
                context.advance();
                return context.nodes().create(NodeKind.NAME, token.text(), token).put("name", token.text());
            case TIE_MARKER:
                context.advance();
                return context.nodes().create(NodeKind.TIE, token.text(), token);
            case FUNCTION_INVOCATION:
                return invocationHandler.parse(context);
            default:
                break;
        }
        if (token.is("(")) {
            context.advance();
            AstNode inner = comparison(context);
            context.expect(TokenType.PUNCTUATION, ")", "')'");
            return inner;
        }
        context.reportError("Expected expression but found '" + token.text() + "'", token);
        if (!context.isAnchorAt(0)) {
            context.advance();
        }
        return context.nodes().create(NodeKind.SYNTAX_ERROR, token.text(), token).put("construct", "Expression");
    }

    /**
     * Creates a {@code Number} node. A literal outside the int range is reported and keeps a null value.
     * @param context The parsing context.
     * @param token The integer literal.
     * @return The node.
     */
    public static AstNode number(ParsingContext context, Token token) {
        AstNode node = context.nodes().create(NodeKind.NUMBER, token.text(), token);
        try {
            node.put("value", Integer.parseInt(token.text()));
        } catch (NumberFormatException e) {
            context.reportError("Integer literal out of range: " + token.text(), token);
            node.put("value", null);
        }
        return node;
    }

    private static AstNode binary(ParsingContext context, Token operator, AstNode left, AstNode right) {
        return context.nodes().create(NodeKind.BINARY_OP, operator.text(), left.line(), left.column())
                .put("operator", operator.text())
                .addChild(left)
                .addChild(right);
    }

    private static boolean isArithmetic(Token token, String... operators) {
        if (token == null || token.type() != TokenType.ARITHMETIC_OPERATOR) {
            return false;
        }
        for (String op : operators) {
            if (token.text().equals(op)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Renders an expression back to source-like text, for the {@code condition} attribute.
     * @param node The expression root.
     * @return The text.
     */
    public static String render(AstNode node) {
        return switch (node.kind()) {
            case BINARY_OP -> render(node.getChildren().get(0)) + " " + node.content() + " "
                    + render(node.getChildren().get(1));
            case UNARY_OP -> node.content() + render(node.getChildren().get(0));
            case INVOCATION, NARRATE, DIRECT -> node.content() + "(" + String.join(", ", node.stringListAttribute("args")) + ")";
            default -> node.content();
        };
    }
}
