package org.automatic.compiler.ir;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Represents an instruction in the intermediate representation. Instructions that produce a
 * value name it with a {@link IrValue.Local}.
 */
public sealed interface IrInstruction {

    /**
     * @return The instruction as one line of IR text, without indentation.
     */
    String render();

    /**
     * @return {@code true} for instructions that end a basic block.
     */
    default boolean isTerminator() {
        return false;
    }

    record Alloca(IrValue.Local result, IrType allocated) implements IrInstruction {
        @Override
        public String render() {
            return result.render() + " = alloca " + allocated.render();
        }
    }

    record Load(IrValue.Local result, IrValue pointer) implements IrInstruction {
        @Override
        public String render() {
            return result.render() + " = load " + result.type().render() + ", " + pointer.typed();
        }
    }

    record Store(IrValue value, IrValue pointer) implements IrInstruction {
        @Override
        public String render() {
            return "store " + value.typed() + ", " + pointer.typed();
        }
    }

    record Binary(IrValue.Local result, BinaryOpcode opcode, IrValue left, IrValue right) implements IrInstruction {
        @Override
        public String render() {
            return result.render() + " = " + opcode.mnemonic() + " " + left.typed() + ", " + right.render();
        }
    }

    record Compare(IrValue.Local result, ComparePredicate predicate, IrValue left, IrValue right) implements IrInstruction {
        @Override
        public String render() {
            return result.render() + " = " + predicate.instruction() + " " + predicate.condition() + " "
                    + left.typed() + ", " + right.render();
        }
    }

    record FNeg(IrValue.Local result, IrValue operand) implements IrInstruction {
        @Override
        public String render() {
            return result.render() + " = fneg " + operand.typed();
        }
    }

    record ZExt(IrValue.Local result, IrValue value) implements IrInstruction {
        @Override
        public String render() {
            return result.render() + " = zext " + value.typed() + " to " + result.type().render();
        }
    }

    record Select(IrValue.Local result, IrValue condition, IrValue ifTrue, IrValue ifFalse) implements IrInstruction {
        @Override
        public String render() {
            return result.render() + " = select " + condition.typed() + ", " + ifTrue.typed() + ", " + ifFalse.typed();
        }
    }

    /**
     * A call. {@code result} is {@code null} when the value is not used or the callee returns void.
     * {@code calleeType} is the explicit function type needed for variadic callees, otherwise {@code null}.
     */
    record Call(IrValue.Local result, IrType returnType, String callee, String calleeType, List<IrValue> arguments)
            implements IrInstruction {
        @Override
        public String render() {
            String args = arguments.stream().map(IrValue::typed).collect(Collectors.joining(", "));
            String prefix = result == null ? "" : result.render() + " = ";
            String type = calleeType == null ? returnType.render() : returnType.render() + " " + calleeType;
            return prefix + "call " + type + " @" + callee + "(" + args + ")";
        }
    }

    record Br(String target) implements IrInstruction {
        @Override
        public String render() {
            return "br label %" + target;
        }

        @Override
        public boolean isTerminator() {
            return true;
        }
    }

    record CondBr(IrValue condition, String ifTrue, String ifFalse) implements IrInstruction {
        @Override
        public String render() {
            return "br " + condition.typed() + ", label %" + ifTrue + ", label %" + ifFalse;
        }

        @Override
        public boolean isTerminator() {
            return true;
        }
    }

    /**
     * A return; {@code value} is {@code null} for {@code ret void}.
     */
    record Ret(IrValue value) implements IrInstruction {
        @Override
        public String render() {
            return value == null ? "ret void" : "ret " + value.typed();
        }

        @Override
        public boolean isTerminator() {
            return true;
        }
    }
}
