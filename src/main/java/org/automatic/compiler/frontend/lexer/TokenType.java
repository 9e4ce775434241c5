package org.automatic.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Literals.
    /** An identifier: uppercase letters, digits and underscores. Also used for reserved words. */
    IDENTIFIER,
    /** A maximal run of decimal digits. */
    INTEGER,
    /** A double-quoted string literal without escapes. */
    STRING,

    // Layout.
    /** Spaces, tabs, carriage returns and line comments. */
    WHITESPACE,
    /** A newline character. */
    NEWLINE,

    // Directives, produced after a '#'.
    /** {@code #INCLUDE "unit"} */
    INCLUDE,
    /** {@code #DEFINE NAME [value]} */
    DEFINE,
    /** {@code #UNDEF NAME} */
    UNDEF,
    /** {@code #IFDEF NAME} */
    IFDEF,
    /** {@code #IFNDEF NAME} */
    IFNDEF,
    /** {@code #END}, closing the innermost conditional. */
    END,

    // Miscellaneous.
    /** Represents the end of the source unit. */
    END_OF_FILE,
    /** Any other single character; the parser decides whether it is valid. */
    CHAR;

    /**
     * @return {@code true} for the directive keyword tokens.
     */
    public boolean isDirective() {
        return switch (this) {
            case INCLUDE, DEFINE, UNDEF, IFDEF, IFNDEF, END -> true;
            default -> false;
        };
    }
}
