package org.olympiac.compiler.frontend.parser.features.invocation;

import org.olympiac.compiler.frontend.lexer.Token;
import org.olympiac.compiler.frontend.lexer.TokenType;
import org.olympiac.compiler.frontend.parser.IKeywordHandler;
import org.olympiac.compiler.frontend.parser.Keywords;
import org.olympiac.compiler.frontend.parser.ParsingContext;
import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.parser.ast.NodeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles invocation tokens such as {@code narrar(}, {@code input(} and {@code Comparar(}.
 * <p>
 * Arguments are kept as source text in the {@code args} attribute. A nested invocation
 * becomes a single argument. {@code narrar(} yields a {@code Narrate} node and requires
 * exactly one argument; {@code input(} yields a {@code Direct} node; every other name
 * yields a generic {@code Invocation}.
 */
public class InvocationHandler implements IKeywordHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token function = context.advance();
        String name = function.text().substring(0, function.text().length() - 1);
        List<String> args = new ArrayList<>();
        boolean closed = collectArguments(context, args);

        String normalized = Keywords.normalize(function.text());
        NodeKind kind = normalized.equals(Keywords.NARRATE) ? NodeKind.NARRATE
                : normalized.equals(Keywords.DIRECT) ? NodeKind.DIRECT
                : NodeKind.INVOCATION;
        AstNode node = context.nodes().create(kind, name, function)
                .put("name", name)
                .put("args", args)
                .put("arity", args.size());

        if (!closed) {
            context.reportError("Expected ')' to close '" + function.text() + "' but " + context.describeCurrent(),
                    context.peek());
        }
        if (kind == NodeKind.NARRATE) {
            if (args.size() == 1) {
                node.put("target", args.get(0));
            } else {
                context.reportError("narrar expects exactly one argument but got " + args.size(), function);
            }
        }
        return node;
    }

    /**
     * Collects the arguments up to the matching ')'. Stops without consuming at a brace or
     * bracket, a declaration or control-flow keyword, or an anchor on a new line.
     * @return true if the closing parenthesis was consumed.
     */
    private static boolean collectArguments(ParsingContext context, List<String> args) {
        List<Token> pending = new ArrayList<>();
        int depth = 0;
        while (!context.isAtEnd()) {
            Token token = context.peek();
            if (depth == 0 && token.is(")")) {
                context.advance();
                flush(pending, args);
                return true;
            }
            if (depth == 0 && token.is(",")) {
                context.advance();
                flush(pending, args);
                continue;
            }
            if (token.is("}") || token.is("]")
                    || token.type() == TokenType.CONTROL_FLOW || token.type() == TokenType.ENTITY_DECLARATION
                    || (context.startsLineAt(0) && context.isAnchorAt(0))) {
                break;
            }
            if (token.type() == TokenType.FUNCTION_INVOCATION || token.is("(")) {
                depth++;
            } else if (token.is(")")) {
                depth--;
            }
            pending.add(context.advance());
        }
        flush(pending, args);
        return false;
    }

    private static void flush(List<Token> pending, List<String> args) {
        if (pending.isEmpty()) {
            return;
        }
        StringBuilder text = new StringBuilder();
        Token previous = null;
        for (Token token : pending) {
            boolean glue = previous == null || previous.text().endsWith("(") || token.is(")") || token.is(",");
            if (!glue) {
                text.append(' ');
            }
            text.append(token.text());
            previous = token;
        }
        args.add(text.toString());
        pending.clear();
    }
}
