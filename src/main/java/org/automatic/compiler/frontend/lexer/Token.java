package org.automatic.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token: the {@code Integer} of an integer literal
 *              ({@code null} if it is out of range), the content of a string literal.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical unit name from which this token originates
 *                 (set correctly after preprocessor/include).
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {
    /**
     * @return {@code true} for whitespace and line-end tokens.
     */
    public boolean isLayout() {
        return type == TokenType.WHITESPACE || type == TokenType.NEWLINE;
    }

    /**
     * Checks for a single-character fallback token with the given character.
     * @param c The character.
     * @return {@code true} if this token is exactly that character.
     */
    public boolean isChar(char c) {
        return type == TokenType.CHAR && text.length() == 1 && text.charAt(0) == c;
    }

    /**
     * Creates a copy of this token placed at another source position.
     * Used when a macro value replaces an identifier at its use site.
     * @param at The token whose position to take.
     * @return The relocated token.
     */
    public Token relocatedTo(Token at) {
        return new Token(type, text, value, at.line(), at.column(), at.fileName());
    }
}
