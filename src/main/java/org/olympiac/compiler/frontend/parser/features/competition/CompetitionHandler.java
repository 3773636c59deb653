package org.olympiac.compiler.frontend.parser.features.competition;

import org.olympiac.compiler.frontend.lexer.Token;
import org.olympiac.compiler.frontend.parser.IKeywordHandler;
import org.olympiac.compiler.frontend.parser.ParsingContext;
import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.parser.ast.NodeKind;

/**
 * Handles the keyword-delimited competitions: {@code InicioCarrera ... finCarr},
 * {@code InicioRutina ... finRuti} and {@code preparacion ... finprep}.
 * A missing result or terminator is reported and the partial node is returned.
 */
public class CompetitionHandler implements IKeywordHandler {

    private final NodeKind kind;
    private final String terminator;

    /**
     * @param kind The competition node kind to produce.
     * @param terminator The closing keyword.
     */
    public CompetitionHandler(NodeKind kind, String terminator) {
        if (!kind.isCompetition()) {
            throw new IllegalArgumentException(kind + " is not a competition kind");
        }
        this.kind = kind;
        this.terminator = terminator;
    }

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        AstNode node = context.nodes().create(kind, keyword.text(), keyword)
                .put("start", keyword.text())
                .put("end", terminator);
        CompetitionBody.parse(context, node, terminator);
        return node;
    }
}
