package org.automatic.compiler.api;

/**
 * The compilation stage an error belongs to.
 */
public enum ErrorKind {
    /** Malformed text, unterminated strings, bad directives, unresolved includes. */
    LEXICAL,
    /** Unexpected tokens or unexpected end of input. */
    SYNTAX,
    /** Scoping and typing violations found by the semantic analyzer. */
    SEMANTIC,
    /** A defect in the compiler itself: the analyzer let something through that generation cannot handle. */
    INTERNAL
}
