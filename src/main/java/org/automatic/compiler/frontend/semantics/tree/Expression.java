package org.automatic.compiler.frontend.semantics.tree;

import org.automatic.compiler.frontend.parser.ast.BinaryOperator;
import org.automatic.compiler.frontend.parser.ast.UnaryOperator;
import org.automatic.compiler.frontend.semantics.BuiltinFunction;

import java.util.List;

/**
 * The expression forms of the typed tree.
 */
public sealed interface Expression {

    record IntLit(int value) implements Expression {}

    record FloatLit(double value) implements Expression {}

    record BoolLit(boolean value) implements Expression {}

    record StrLit(String value) implements Expression {}

    /**
     * A matrix literal. Elements are {@link IntLit}, {@link FloatLit} or {@link BoolLit} with any
     * negation already folded in.
     *
     * @param rows The rows of element expressions.
     */
    record MatrixLit(List<List<TypedExpression>> rows) implements Expression {}

    record Id(String name) implements Expression {}

    record Binary(BinaryOperator operator, TypedExpression left, TypedExpression right) implements Expression {}

    record Unary(UnaryOperator operator, TypedExpression operand) implements Expression {}

    record Assign(String target, TypedExpression value) implements Expression {}

    /**
     * A call.
     *
     * @param callee The function name.
     * @param builtin The built-in, or {@code null} for a user function.
     * @param arguments The arguments, evaluated left to right.
     */
    record Call(String callee, BuiltinFunction builtin, List<TypedExpression> arguments) implements Expression {
        /**
         * @return {@code true} for PRINT, PRINTSTR, ROWS and COLS.
         */
        public boolean isBuiltin() {
            return builtin != null;
        }
    }

    /** The empty expression; it has type VOID and produces nothing. */
    record NoExpr() implements Expression {}
}
