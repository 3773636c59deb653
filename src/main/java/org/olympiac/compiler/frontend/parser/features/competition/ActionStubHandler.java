package org.olympiac.compiler.frontend.parser.features.competition;

import org.olympiac.compiler.frontend.lexer.Token;
import org.olympiac.compiler.frontend.lexer.TokenType;
import org.olympiac.compiler.frontend.parser.IKeywordHandler;
import org.olympiac.compiler.frontend.parser.Keywords;
import org.olympiac.compiler.frontend.parser.ParsingContext;
import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.parser.ast.NodeKind;

/**
 * Handles domain keywords without a dedicated grammar rule, such as {@code correr} or
 * {@code ceremonia_medallas}. The stub absorbs the following commands as children until a
 * competition terminator, a result boundary, a closer or another domain keyword opening a new
 * line. It consumes none of these, so actions written one per line become siblings.
 */
public class ActionStubHandler implements IKeywordHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        AstNode stub = context.nodes().create(NodeKind.ACTION_STUB, keyword.text(), keyword)
                .put("keyword", keyword.text());
        while (!context.isAtEnd() && !atBoundary(context)) {
            stub.addChild(context.parseCommand());
        }
        return stub;
    }

    private static boolean atBoundary(ParsingContext context) {
        Token token = context.peek();
        String word = Keywords.normalize(token.text());
        if (Keywords.COMPETITION_TERMINATORS.contains(word)) {
            return true;
        }
        if (token.type() == TokenType.DOMAIN_KEYWORD && context.startsLineAt(0)) {
            return true;
        }
        if (token.type() == TokenType.RESULT_MARKER || token.type() == TokenType.TIE_MARKER
                || (token.type() == TokenType.DOMAIN_TYPE && word.equals(Keywords.RESULT))) {
            return true;
        }
        return (token.type() == TokenType.CONTROL_FLOW && Keywords.CONTROL_CLOSERS.contains(word))
                || token.is("}") || token.is("]");
    }
}
