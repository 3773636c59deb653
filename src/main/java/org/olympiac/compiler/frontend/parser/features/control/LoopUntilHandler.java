package org.olympiac.compiler.frontend.parser.features.control;

import org.olympiac.compiler.frontend.lexer.Token;
import org.olympiac.compiler.frontend.parser.IKeywordHandler;
import org.olympiac.compiler.frontend.parser.Keywords;
import org.olympiac.compiler.frontend.parser.ParsingContext;
import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.parser.ast.NodeKind;
import org.olympiac.compiler.frontend.parser.features.expression.ExpressionParser;

/**
 * Handles {@code RepetirHasta ( <condition> ) [ ... ] FinRepHasta}.
 * The older closing spelling {@code FinRepHast} is accepted as well.
 */
public class LoopUntilHandler implements IKeywordHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        AstNode loop = context.nodes().create(NodeKind.LOOP_UNTIL, keyword.text(), keyword);

        // Reported without recovery.
        context.expect(null, "(", "'('");
        AstNode condition = context.parseExpression();
        loop.addChild(condition).put("condition", ExpressionParser.render(condition));
        context.expectDelimiter(")", "[");
        context.expectDelimiter("[", Keywords.END_LOOP_UNTIL, Keywords.END_LOOP_UNTIL_LEGACY);
        context.parseBody(Keywords.END_LOOP_UNTIL, Keywords.END_LOOP_UNTIL_LEGACY).forEach(loop::addChild);
        context.expectDelimiter("]", Keywords.END_LOOP_UNTIL, Keywords.END_LOOP_UNTIL_LEGACY);
        if (!context.matchText(Keywords.END_LOOP_UNTIL) && !context.matchText(Keywords.END_LOOP_UNTIL_LEGACY)) {
            context.expectDelimiter("FinRepHasta", Keywords.END_LOOP_UNTIL_LEGACY);
            context.matchText(Keywords.END_LOOP_UNTIL_LEGACY);
        }
        return loop;
    }
}
