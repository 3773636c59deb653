package org.olympiac.compiler.frontend.parser.features.control;

import org.olympiac.compiler.frontend.lexer.Token;
import org.olympiac.compiler.frontend.lexer.TokenType;
import org.olympiac.compiler.frontend.parser.IKeywordHandler;
import org.olympiac.compiler.frontend.parser.Keywords;
import org.olympiac.compiler.frontend.parser.ParsingContext;
import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.parser.ast.NodeKind;
import org.olympiac.compiler.frontend.parser.features.expression.ExpressionParser;

/**
 * Handles the counted loop {@code Repetir ( <int> ) [ ... ] FinRep}.
 * The count is the first child; the body commands follow.
 */
public class LoopHandler implements IKeywordHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        AstNode loop = context.nodes().create(NodeKind.LOOP, keyword.text(), keyword);

        // Reported without recovery.
        context.expect(null, "(", "'('");
        Token count = context.expect(TokenType.INTEGER_LITERAL, null, "repetition count");
        if (count != null) {
            AstNode number = ExpressionParser.number(context, count);
            loop.addChild(number).put("count", number.attribute("value"));
        } else {
            loop.put("count", null);
            context.synchronize(")", "[");
        }
        context.expectDelimiter(")", "[");
        context.expectDelimiter("[", Keywords.END_LOOP);
        context.parseBody(Keywords.END_LOOP).forEach(loop::addChild);
        context.expectDelimiter("]", Keywords.END_LOOP);
        context.expectDelimiter("FinRep");
        return loop;
    }
}
