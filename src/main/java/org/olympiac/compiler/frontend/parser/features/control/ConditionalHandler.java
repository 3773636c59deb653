package org.olympiac.compiler.frontend.parser.features.control;

import org.olympiac.compiler.frontend.lexer.Token;
import org.olympiac.compiler.frontend.parser.IKeywordHandler;
import org.olympiac.compiler.frontend.parser.Keywords;
import org.olympiac.compiler.frontend.parser.ParsingContext;
import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.parser.ast.NodeKind;
import org.olympiac.compiler.frontend.parser.features.expression.ExpressionParser;

/**
 * Handles {@code si <condition> entonces { ... } endif} with an optional {@code sino} branch.
 * Both {@code { a sino { b } } endif} and the {@code { a } sino { b } endif} spelling are accepted.
 * <p>
 * The condition is the first child, followed by the commands of the body and, if present,
 * one {@code Else} node holding the commands of the alternative branch.
 */
public class ConditionalHandler implements IKeywordHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        AstNode conditional = context.nodes().create(NodeKind.CONDITIONAL, keyword.text(), keyword);

        AstNode condition = context.parseExpression();
        conditional.addChild(condition).put("condition", ExpressionParser.render(condition));

        context.expectDelimiter(Keywords.THEN, "{");
        context.expectDelimiter("{", Keywords.ELSE, Keywords.END_IF);
        context.parseBody(Keywords.ELSE, Keywords.END_IF).forEach(conditional::addChild);

        boolean closed = context.matchText("}");
        if (context.checkText(Keywords.ELSE)) {
            Token elseToken = context.advance();
            AstNode elseBranch = context.nodes().create(NodeKind.ELSE, elseToken.text(), elseToken);
            context.expectDelimiter("{", Keywords.END_IF);
            context.parseBody(Keywords.ELSE, Keywords.END_IF).forEach(elseBranch::addChild);
            context.expectDelimiter("}", Keywords.END_IF);
            conditional.addChild(elseBranch);
            if (!closed) {
                closed = context.matchText("}");
            }
        }
        if (!closed) {
            context.expectDelimiter("}", Keywords.END_IF);
        }
        context.expectDelimiter(Keywords.END_IF);
        return conditional;
    }
}
