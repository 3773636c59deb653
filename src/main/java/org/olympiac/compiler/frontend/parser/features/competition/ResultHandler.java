package org.olympiac.compiler.frontend.parser.features.competition;

import org.olympiac.compiler.frontend.lexer.Token;
import org.olympiac.compiler.frontend.lexer.TokenType;
import org.olympiac.compiler.frontend.parser.IKeywordHandler;
import org.olympiac.compiler.frontend.parser.ParsingContext;
import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.parser.ast.NodeKind;

/**
 * Handles {@code Resultado <int> - <int>}. A missing score leaves {@code null} in its slot;
 * the verifier reports incomplete results, so the parser only reports a missing dash between
 * two present scores.
 */
public class ResultHandler implements IKeywordHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        Integer home = score(context);
        boolean dash = context.check(TokenType.ARITHMETIC_OPERATOR) && context.checkText("-");
        if (dash) {
            context.advance();
        } else if (home != null && context.check(TokenType.INTEGER_LITERAL)) {
            context.reportError("Expected '-' between the scores but " + context.describeCurrent(), context.peek());
        }
        Integer away = home == null && !dash ? null : score(context);

        return context.nodes().create(NodeKind.RESULT, keyword.text(), keyword)
                .put("home", home)
                .put("away", away)
                .put("complete", home != null && away != null);
    }

    private static Integer score(ParsingContext context) {
        if (!context.check(TokenType.INTEGER_LITERAL)) {
            return null;
        }
        Token token = context.advance();
        try {
            return Integer.parseInt(token.text());
        } catch (NumberFormatException e) {
            context.reportError("Integer literal out of range: " + token.text(), token);
            return null;
        }
    }
}
