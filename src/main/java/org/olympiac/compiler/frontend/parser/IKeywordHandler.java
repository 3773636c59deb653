package org.olympiac.compiler.frontend.parser;

import org.olympiac.compiler.frontend.parser.ast.AstNode;

/**
 * The base interface for all keyword handlers.
 * Each handler is responsible for parsing the construct introduced by a specific keyword
 * (e.g., "Deportista" or "si"). The cursor is on the keyword when {@link #parse} is called.
 */
@FunctionalInterface
public interface IKeywordHandler {

    /**
     * Parses the construct and its arguments.
     *
     * @param context The context that provides access to the token stream and other
     *                services of the parser.
     * @return The node for this construct. Never {@code null}; malformed input yields a
     *         partial node or a syntax error node.
     */
    AstNode parse(ParsingContext context);
}
