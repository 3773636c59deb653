package org.olympiac.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The category of the token.
 * @param text The exact text of the token from the source code.
 * @param line The line number where the token was found (1-based).
 * @param column The column number where the token begins (1-based).
 */
public record Token(
        TokenType type,
        String text,
        int line,
        int column
) {
    /**
     * Checks the token text, ignoring case. Keywords of the language are matched this way.
     * @param expected The text to compare with.
     * @return true if the texts are equal ignoring case.
     */
    public boolean is(String expected) {
        return text.equalsIgnoreCase(expected);
    }

    @Override
    public String toString() {
        return String.format("<\"%s\", \"%s\", %d:%d>", type, text, line, column);
    }
}
