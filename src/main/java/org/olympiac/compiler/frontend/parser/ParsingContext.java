package org.olympiac.compiler.frontend.parser;

import org.olympiac.compiler.diagnostics.DiagnosticsEngine;
import org.olympiac.compiler.frontend.lexer.Token;
import org.olympiac.compiler.frontend.lexer.TokenType;
import org.olympiac.compiler.frontend.parser.ast.AstNode;
import org.olympiac.compiler.frontend.parser.ast.NodeArena;

import java.util.List;

/**
 * An interface that encapsulates the cursor and services available while parsing.
 * It provides keyword handlers with access to the token stream, node creation,
 * error reporting and recovery without coupling them directly to the {@link Parser}.
 * <p>
 * None of these methods throws on malformed input. A failed expectation returns
 * {@code null} after recording a diagnostic.
 */
public interface ParsingContext {

    /**
     * Returns the current token without consuming it.
     * @return The current token, or {@code null} at the end of the stream.
     */
    Token peek();

    /**
     * Looks ahead without consuming.
     * @param offset 0 for the current token, 1 for the one after it, and so on.
     * @return The token at that offset, or {@code null} beyond the end of the stream.
     */
    Token peekAt(int offset);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token, or {@code null} at the end of the stream.
     */
    Token advance();

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if no tokens are left.
     */
    boolean isAtEnd();

    /**
     * Checks the category of the current token without consuming it.
     * @param type The category to check.
     * @return true if the current token has this category.
     */
    boolean check(TokenType type);

    /**
     * Checks the text of the current token, ignoring case, without consuming it.
     * @param text The text to check.
     * @return true if the current token has this text.
     */
    boolean checkText(String text);

    /**
     * Consumes the current token if its text matches, ignoring case.
     * @param text The text to match.
     * @return true if a token was consumed.
     */
    boolean matchText(String text);

    /**
     * Consumes the current token if it has the expected category and, when given, text.
     * Otherwise reports an "Expected ..." diagnostic and leaves the cursor where it is.
     * @param type The expected category, or {@code null} for any.
     * @param text The expected text (ignoring case), or {@code null} for any.
     * @param what A description of the expected token for the diagnostic.
     * @return The consumed token, or {@code null} if it did not match.
     */
    Token expect(TokenType type, String text, String what);

    /**
     * Expects a delimiter; when it is missing, reports it and synchronizes. If recovery stops
     * on the delimiter itself, it is consumed.
     * @param text The delimiter text.
     * @param follow Texts at which recovery may stop besides the usual anchors.
     * @return true if the delimiter was found directly, false if it was missing.
     */
    boolean expectDelimiter(String text, String... follow);

    /**
     * Skips tokens until a stable anchor or one of the given follow texts. The number of
     * skipped tokens is bounded; once the bound is hit, the rest of the stream is discarded.
     * @param follow Texts (ignoring case) at which recovery may stop besides the usual anchors.
     */
    void synchronize(String... follow);

    /**
     * Checks whether the token at the given lookahead offset is a recovery anchor.
     * @param offset The lookahead offset.
     * @return true if recovery would stop there.
     */
    boolean isAnchorAt(int offset);

    /**
     * Checks whether the token at the given lookahead offset is the first token of its line.
     * @param offset The lookahead offset.
     * @return true if no earlier token shares its line.
     */
    boolean startsLineAt(int offset);

    /**
     * Saves the cursor position for a bounded lookahead with rollback.
     * @return An opaque mark.
     */
    int mark();

    /**
     * Restores a position saved by {@link #mark()}.
     * @param mark The saved mark.
     */
    void reset(int mark);

    /**
     * Parses one command at the cursor. Always consumes at least one token unless at the end.
     * @return The parsed node, or {@code null} at the end of the stream.
     */
    AstNode parseCommand();

    /**
     * Parses commands until the end of the stream, a closing brace or bracket, or one of the
     * terminators. Neither the closer nor the terminator is consumed.
     * @param terminators Texts (ignoring case) that end the body.
     * @return The parsed commands.
     */
    List<AstNode> parseBody(String... terminators);

    /**
     * Parses an expression with the usual precedence: comparison, additive, multiplicative, unary.
     * @return The expression node, a syntax error node if no expression starts here.
     */
    AstNode parseExpression();

    /**
     * Describes the current token for an "Expected ..." message.
     * @return {@code found 'x'}, or {@code reached end of input}.
     */
    default String describeCurrent() {
        Token token = peek();
        return token == null ? "reached end of input" : "found '" + token.text() + "'";
    }

    /**
     * Reports a syntax error at a token, or at the end of the stream when the token is null.
     * @param message The message.
     * @param at The offending token, may be null.
     */
    void reportError(String message, Token at);

    /**
     * Reports a syntax warning at a token.
     * @param message The message.
     * @param at The offending token, may be null.
     */
    void reportWarning(String message, Token at);

    /**
     * @return The arena that creates the nodes of this tree.
     */
    NodeArena nodes();

    /**
     * @return The engine collecting syntax diagnostics.
     */
    DiagnosticsEngine getDiagnostics();
}
