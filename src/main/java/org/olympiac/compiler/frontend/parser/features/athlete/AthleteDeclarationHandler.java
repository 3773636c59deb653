package org.olympiac.compiler.frontend.parser.features.athlete;

import org.olympiac.compiler.frontend.lexer.Token;
import org.olympiac.compiler.frontend.lexer.TokenType;
import org.olympiac.compiler.frontend.parser.IKeywordHandler;
import org.olympiac.compiler.frontend.parser.ParsingContext;
import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.parser.ast.NodeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles the {@code Deportista <name> <int> <int> <int> <sport> <country>} declaration.
 * <p>
 * A declaration missing any field becomes a {@code SyntaxError} node that keeps the fields
 * read so far, and exactly one "Incomplete declaration" diagnostic is reported before the
 * parser resynchronizes. Identifiers skipped by the recovery become children of that node.
 */
public class AthleteDeclarationHandler implements IKeywordHandler {

    /** Number of integer statistics an athlete carries. */
    public static final int STAT_COUNT = 3;

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();

        Token name = take(context, TokenType.IDENTIFIER);
        if (name == null) {
            return incomplete(context, keyword, null, List.of(), null, "athlete name");
        }
        List<Integer> stats = new ArrayList<>();
        for (int i = 0; i < STAT_COUNT; i++) {
            Token stat = take(context, TokenType.INTEGER_LITERAL);
            Integer value = stat == null ? null : parseStat(stat.text());
            if (value == null) {
                return incomplete(context, keyword, name, stats, null, "statistic " + (i + 1) + " of " + STAT_COUNT);
            }
            stats.add(value);
        }
        Token sport = take(context, TokenType.IDENTIFIER);
        if (sport == null) {
            return incomplete(context, keyword, name, stats, null, "sport");
        }
        Token country = take(context, TokenType.IDENTIFIER);
        if (country == null) {
            return incomplete(context, keyword, name, stats, sport, "country");
        }

        return context.nodes().create(NodeKind.ATHLETE_DECL, name.text(), keyword)
                .put("name", name.text())
                .put("stats", stats)
                .put("sport", sport.text())
                .put("country", country.text());
    }

    private AstNode incomplete(ParsingContext context, Token keyword, Token name, List<Integer> stats,
                               Token sport, String missing) {
        context.reportError("Incomplete declaration of '" + keyword.text() + "': expected " + missing
                + " but " + context.describeCurrent(), context.peek());
        AstNode node = context.nodes().create(NodeKind.SYNTAX_ERROR, keyword.text(), keyword)
                .put("construct", NodeKind.ATHLETE_DECL.displayName());
        if (name != null) {
            node.put("name", name.text());
        }
        if (!stats.isEmpty()) {
            node.put("stats", List.copyOf(stats));
        }
        if (sport != null) {
            node.put("sport", sport.text());
        }
        int from = context.mark();
        context.synchronize();
        int to = context.mark();
        for (int offset = from - to; offset < 0; offset++) {
            Token skipped = context.peekAt(offset);
            if (skipped.type() == TokenType.IDENTIFIER) {
                node.addChild(context.nodes().create(NodeKind.IDENTIFIER, skipped.text(), skipped)
                        .put("name", skipped.text()));
            }
        }
        return node;
    }

    private static Token take(ParsingContext context, TokenType type) {
        return context.check(type) ? context.advance() : null;
    }

    private static Integer parseStat(String text) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
