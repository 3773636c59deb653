package org.olympiac.compiler.frontend.parser.features.competition;

import org.olympiac.compiler.frontend.lexer.Token;
import org.olympiac.compiler.frontend.parser.IKeywordHandler;
import org.olympiac.compiler.frontend.parser.ParsingContext;
import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.parser.ast.NodeKind;

/**
 * Handles the {@code empate} marker as a leaf {@code Tie} node.
 */
public class TieHandler implements IKeywordHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token marker = context.advance();
        return context.nodes().create(NodeKind.TIE, marker.text(), marker);
    }
}
