package org.automatic.compiler.codegen;

import org.automatic.compiler.frontend.parser.ast.BinaryOperator;
import org.automatic.compiler.ir.BinaryOpcode;
import org.automatic.compiler.ir.ComparePredicate;
import org.automatic.compiler.types.Type;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * The single table that decides how a binary operator lowers. The key is the operator and the
 * static type of the left operand: FLOAT selects the floating-point forms, every other type the
 * integer forms. {@code &&} and {@code ||} only exist as integer forms, the bitwise {@code and}/{@code or}
 * on {@code i1}.
 */
public final class BinaryOperatorTable {

    /**
     * One lowering form: exactly one of the two fields is set.
     *
     * @param opcode The arithmetic or bitwise instruction.
     * @param predicate The comparison predicate.
     */
    public record Form(BinaryOpcode opcode, ComparePredicate predicate) {
        static Form of(BinaryOpcode opcode) {
            return new Form(opcode, null);
        }

        static Form of(ComparePredicate predicate) {
            return new Form(null, predicate);
        }

        /**
         * @return {@code true} if the form compares and yields {@code i1}.
         */
        public boolean isComparison() {
            return predicate != null;
        }
    }

    private static final Map<BinaryOperator, Form> INTEGER_FORMS;
    private static final Map<BinaryOperator, Form> FLOAT_FORMS;

    static {
        Map<BinaryOperator, Form> integer = new EnumMap<>(BinaryOperator.class);
        integer.put(BinaryOperator.ADD, Form.of(BinaryOpcode.ADD));
        integer.put(BinaryOperator.SUB, Form.of(BinaryOpcode.SUB));
        integer.put(BinaryOperator.MUL, Form.of(BinaryOpcode.MUL));
        integer.put(BinaryOperator.DIV, Form.of(BinaryOpcode.SDIV));
        integer.put(BinaryOperator.AND, Form.of(BinaryOpcode.AND));
        integer.put(BinaryOperator.OR, Form.of(BinaryOpcode.OR));
        integer.put(BinaryOperator.EQ, Form.of(ComparePredicate.EQ));
        integer.put(BinaryOperator.NE, Form.of(ComparePredicate.NE));
        integer.put(BinaryOperator.LT, Form.of(ComparePredicate.SLT));
        integer.put(BinaryOperator.LE, Form.of(ComparePredicate.SLE));
        integer.put(BinaryOperator.GT, Form.of(ComparePredicate.SGT));
        integer.put(BinaryOperator.GE, Form.of(ComparePredicate.SGE));
        INTEGER_FORMS = Collections.unmodifiableMap(integer);

        Map<BinaryOperator, Form> floating = new EnumMap<>(BinaryOperator.class);
        floating.put(BinaryOperator.ADD, Form.of(BinaryOpcode.FADD));
        floating.put(BinaryOperator.SUB, Form.of(BinaryOpcode.FSUB));
        floating.put(BinaryOperator.MUL, Form.of(BinaryOpcode.FMUL));
        floating.put(BinaryOperator.DIV, Form.of(BinaryOpcode.FDIV));
        floating.put(BinaryOperator.EQ, Form.of(ComparePredicate.OEQ));
        floating.put(BinaryOperator.NE, Form.of(ComparePredicate.ONE));
        floating.put(BinaryOperator.LT, Form.of(ComparePredicate.OLT));
        floating.put(BinaryOperator.LE, Form.of(ComparePredicate.OLE));
        floating.put(BinaryOperator.GT, Form.of(ComparePredicate.OGT));
        floating.put(BinaryOperator.GE, Form.of(ComparePredicate.OGE));
        FLOAT_FORMS = Collections.unmodifiableMap(floating);
    }

    private BinaryOperatorTable() {}

    /**
     * @param operator The operator.
     * @param leftType The static type of the left operand.
     * @return The form, or empty if the combination has no lowering.
     */
    public static Optional<Form> lookup(BinaryOperator operator, Type leftType) {
        Map<BinaryOperator, Form> forms = leftType == Type.FLOAT ? FLOAT_FORMS : INTEGER_FORMS;
        return Optional.ofNullable(forms.get(operator));
    }
}
