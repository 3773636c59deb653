package org.olympiac.compiler.frontend.parser.features.competition;

import org.olympiac.compiler.frontend.lexer.Token;
import org.olympiac.compiler.frontend.lexer.TokenType;
import org.olympiac.compiler.frontend.parser.Keywords;
import org.olympiac.compiler.frontend.parser.ParsingContext;
import org.olympiac.compiler.frontend.parser.ast.AstNode;

/**
 * The part every competition shares: {@code Action* [Tie] Result ResultExtra* <terminator>}.
 * <p>
 * The first {@code empate} is kept as a child and each later one is reported as a warning.
 * Once a result has been read, any token other than another result marker or the terminator
 * ends the construct.
 */
final class CompetitionBody {

    private CompetitionBody() {}

    /**
     * Parses the actions, tie, results and terminator into {@code node}.
     * @param context The parsing context.
     * @param node The competition node receiving the children.
     * @param terminator The closing keyword, e.g. {@code finact}.
     */
    static void parse(ParsingContext context, AstNode node, String terminator) {
        String end = Keywords.normalize(terminator);
        boolean tieSeen = false;
        int results = 0;
        boolean closed = false;

        while (!context.isAtEnd()) {
            Token token = context.peek();
            String word = Keywords.normalize(token.text());
            if (word.equals(end)) {
                context.advance();
                closed = true;
                break;
            }
            if (token.type() == TokenType.TIE_MARKER) {
                AstNode tie = context.parseCommand();
                if (tieSeen) {
                    context.reportWarning("Duplicate 'empate' in " + node.kind().displayName()
                            + "; the first one is kept", token);
                } else {
                    node.addChild(tie);
                    tieSeen = true;
                }
                continue;
            }
            if (token.type() == TokenType.DOMAIN_TYPE && word.equals(Keywords.RESULT)) {
                node.addChild(context.parseCommand());
                results++;
                continue;
            }
            if (token.type() == TokenType.RESULT_MARKER) {
                node.addChild(context.parseCommand());
                continue;
            }
            if (results > 0 || endsActions(token, word)) {
                break;
            }
            node.addChild(context.parseCommand());
        }

        node.put("results", results);
        node.put("closed", closed);
        if (results == 0) {
            context.reportError("Missing 'Resultado' in " + node.kind().displayName() + " '" + node.content() + "'",
                    context.peek());
        }
        if (!closed) {
            context.reportError("Expected '" + terminator + "' to close " + node.kind().displayName()
                    + " but " + context.describeCurrent(), context.peek());
        }
    }

    private static boolean endsActions(Token token, String word) {
        return Keywords.COMPETITION_TERMINATORS.contains(word)
                || (token.type() == TokenType.CONTROL_FLOW && Keywords.CONTROL_CLOSERS.contains(word))
                || token.is("}") || token.is("]");
    }
}
