package org.automatic.compiler.types;

/**
 * The closed set of source-level types: the primitives and fixed-shape matrices.
 * {@link Primitive#AUTO} is a placeholder the semantic analyzer replaces by the
 * type of the initializer; it never survives analysis.
 */
public sealed interface Type permits Type.Primitive, Type.Matrix {

    /** Shorthand for {@link Primitive#INT}. */
    Type INT = Primitive.INT;
    /** Shorthand for {@link Primitive#BOOL}. */
    Type BOOL = Primitive.BOOL;
    /** Shorthand for {@link Primitive#FLOAT}. */
    Type FLOAT = Primitive.FLOAT;
    /** Shorthand for {@link Primitive#VOID}. */
    Type VOID = Primitive.VOID;
    /** Shorthand for {@link Primitive#STRING}. */
    Type STRING = Primitive.STRING;
    /** Shorthand for {@link Primitive#AUTO}. */
    Type AUTO = Primitive.AUTO;

    /**
     * @return {@code true} for INT and FLOAT, the types arithmetic and comparisons accept.
     */
    default boolean isNumeric() {
        return this == Primitive.INT || this == Primitive.FLOAT;
    }

    /**
     * @return {@code true} if values of this type can live in a variable.
     */
    default boolean isStorable() {
        return this != Primitive.VOID && this != Primitive.AUTO;
    }

    /**
     * The non-matrix types. The source keyword is the constant name.
     */
    enum Primitive implements Type {
        INT, BOOL, FLOAT, VOID, STRING, AUTO;

        /**
         * @return {@code true} if matrices may hold elements of this type.
         */
        public boolean isMatrixElement() {
            return this == INT || this == BOOL || this == FLOAT;
        }
    }

    /**
     * A matrix with compile-time dimensions.
     *
     * @param elementType The element type; only INT, BOOL and FLOAT pass analysis.
     * @param rows The number of rows.
     * @param cols The number of columns.
     */
    record Matrix(Type elementType, int rows, int cols) implements Type {
        @Override
        public String toString() {
            return "MATRIX<" + elementType + "," + rows + "," + cols + ">";
        }
    }
}
