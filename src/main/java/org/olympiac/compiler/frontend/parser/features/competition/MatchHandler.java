package org.olympiac.compiler.frontend.parser.features.competition;

import org.olympiac.compiler.frontend.lexer.Token;
import org.olympiac.compiler.frontend.lexer.TokenType;
import org.olympiac.compiler.frontend.parser.IKeywordHandler;
import org.olympiac.compiler.frontend.parser.ParsingContext;
import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.parser.ast.NodeKind;

/**
 * Handles {@code <Country> vs <Country> ... Resultado a - b ... finact}.
 * The parser dispatches here when an identifier is followed by {@code vs}.
 */
public class MatchHandler implements IKeywordHandler {

    static final String TERMINATOR = "finact";

    @Override
    public AstNode parse(ParsingContext context) {
        Token home = context.advance();
        context.advance();
        Token away = context.expect(TokenType.IDENTIFIER, null, "country after 'vs'");

        AstNode match = context.nodes().create(NodeKind.MATCH, home.text() + " vs " + (away == null ? "?" : away.text()), home)
                .put("home", home.text())
                .put("away", away == null ? null : away.text());
        CompetitionBody.parse(context, match, TERMINATOR);
        return match;
    }
}
