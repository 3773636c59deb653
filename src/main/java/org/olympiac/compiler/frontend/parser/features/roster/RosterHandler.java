package org.olympiac.compiler.frontend.parser.features.roster;

import org.olympiac.compiler.frontend.lexer.Token;
import org.olympiac.compiler.frontend.lexer.TokenType;
import org.olympiac.compiler.frontend.parser.IKeywordHandler;
import org.olympiac.compiler.frontend.parser.Keywords;
import org.olympiac.compiler.frontend.parser.ParsingContext;
import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.parser.ast.NodeKind;
import org.olympiac.compiler.frontend.parser.features.athlete.AthleteDeclarationHandler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Handles {@code Lista}. Two forms share the keyword:
 * <ul>
 *   <li>a simple declaration {@code Lista <Type> <Name>}, and</li>
 *   <li>a bulk load {@code Lista Deportista} followed by athlete tuples
 *       {@code <name> <int> <int> <int> <sport> <country>}.</li>
 * </ul>
 * After {@code Lista Deportista} the three tokens following the candidate name decide: if all
 * three are integer literals the tuples are parsed, otherwise the name belongs to a simple
 * declaration. A tuple that fails part way is rolled back, and a bulk load with no complete
 * tuple falls back to the simple declaration.
 */
public class RosterHandler implements IKeywordHandler {

    private static final String ATHLETE_TYPE = "Deportista";

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();

        if (context.check(TokenType.ENTITY_DECLARATION) && context.checkText(Keywords.ATHLETE)) {
            Token type = context.advance();
            if (statisticsFollow(context)) {
                int afterType = context.mark();
                AstNode bulk = parseBulkLoad(context, keyword);
                if (bulk != null) {
                    return bulk;
                }
                context.reset(afterType);
            }
            return simpleDeclaration(context, keyword, type.text());
        }

        Token type = context.peek();
        if (type != null && (type.type() == TokenType.IDENTIFIER || type.type() == TokenType.ENTITY_DECLARATION
                || type.type() == TokenType.DOMAIN_TYPE)) {
            context.advance();
            return simpleDeclaration(context, keyword, type.text());
        }
        context.reportError("Expected list element type but " + context.describeCurrent(), type);
        return context.nodes().create(NodeKind.LIST_DECL, "", keyword)
                .put("type", null)
                .put("name", null);
    }

    /** The exact three-token rule: the three tokens after the candidate name are integers. */
    private static boolean statisticsFollow(ParsingContext context) {
        for (int offset = 1; offset <= AthleteDeclarationHandler.STAT_COUNT; offset++) {
            Token token = context.peekAt(offset);
            if (token == null || token.type() != TokenType.INTEGER_LITERAL) {
                return false;
            }
        }
        return true;
    }

    private AstNode simpleDeclaration(ParsingContext context, Token keyword, String type) {
        Token name = context.expect(TokenType.IDENTIFIER, null, "list name");
        return context.nodes().create(NodeKind.LIST_DECL, name == null ? "" : name.text(), keyword)
                .put("type", type)
                .put("name", name == null ? null : name.text());
    }

    private AstNode parseBulkLoad(ParsingContext context, Token keyword) {
        List<Map<String, Object>> athletes = new ArrayList<>();
        while (context.check(TokenType.IDENTIFIER)) {
            int tupleStart = context.mark();
            Map<String, Object> tuple = parseTuple(context);
            if (tuple == null) {
                context.reset(tupleStart);
                break;
            }
            athletes.add(tuple);
        }
        if (athletes.isEmpty()) {
            return null;
        }
        return context.nodes().create(NodeKind.BULK_LOAD, ATHLETE_TYPE, keyword)
                .put("type", ATHLETE_TYPE)
                .put("athletes", athletes)
                .put("count", athletes.size());
    }

    private static Map<String, Object> parseTuple(ParsingContext context) {
        Token name = take(context, TokenType.IDENTIFIER);
        if (name == null) {
            return null;
        }
        List<Integer> stats = new ArrayList<>();
        for (int i = 0; i < AthleteDeclarationHandler.STAT_COUNT; i++) {
            Token stat = take(context, TokenType.INTEGER_LITERAL);
            if (stat == null) {
                return null;
            }
            try {
                stats.add(Integer.parseInt(stat.text()));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        Token sport = take(context, TokenType.IDENTIFIER);
        Token country = sport == null ? null : take(context, TokenType.IDENTIFIER);
        if (country == null) {
            return null;
        }
        Map<String, Object> tuple = new LinkedHashMap<>();
        tuple.put("name", name.text());
        tuple.put("stats", stats);
        tuple.put("sport", sport.text());
        tuple.put("country", country.text());
        tuple.put("line", name.line());
        return tuple;
    }

    private static Token take(ParsingContext context, TokenType type) {
        return context.check(type) ? context.advance() : null;
    }
}
