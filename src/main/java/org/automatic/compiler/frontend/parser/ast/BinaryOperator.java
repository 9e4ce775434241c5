package org.automatic.compiler.frontend.parser.ast;

/**
 * The binary operators with their source symbols.
 */
public enum BinaryOperator {
    ADD("+"), SUB("-"), MUL("*"), DIV("/"),
    LT("<"), LE("<="), GT(">"), GE(">="),
    EQ("=="), NE("!="),
    AND("&&"), OR("||");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return The operator as written in the source.
     */
    public String symbol() {
        return symbol;
    }

    /**
     * @return {@code true} for the relational and equality operators.
     */
    public boolean isComparison() {
        return this == LT || this == LE || this == GT || this == GE || this == EQ || this == NE;
    }

    /**
     * @return {@code true} for && and ||.
     */
    public boolean isLogical() {
        return this == AND || this == OR;
    }
}
