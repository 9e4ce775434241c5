package org.automatic.compiler.frontend.parser.ast;

/**
 * The prefix operators.
 */
public enum UnaryOperator {
    /** Arithmetic negation, {@code -}. */
    NEG,
    /** Logical not, {@code !}. */
    NOT
}
