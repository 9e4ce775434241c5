package org.automatic.compiler.ir;

/**
 * The types of the IR, rendered in LLVM's typed-pointer syntax.
 */
public sealed interface IrType
        permits IrType.IntType, IrType.DoubleType, IrType.VoidType, IrType.PointerType, IrType.ArrayType {

    /** Single-bit integer, used for BOOL. */
    IrType I1 = new IntType(1);
    /** Byte, the element of strings. */
    IrType I8 = new IntType(8);
    /** 32-bit integer, used for INT. */
    IrType I32 = new IntType(32);
    /** 64-bit floating point, used for FLOAT. */
    IrType DOUBLE = new DoubleType();
    /** No value. */
    IrType VOID = new VoidType();
    /** Pointer to bytes, used for STRING. */
    IrType I8_PTR = new PointerType(I8);

    /**
     * @return The type as written in IR text.
     */
    String render();

    /**
     * @return A pointer to this type.
     */
    default PointerType pointer() {
        return new PointerType(this);
    }

    record IntType(int bits) implements IrType {
        @Override
        public String render() {
            return "i" + bits;
        }
    }

    record DoubleType() implements IrType {
        @Override
        public String render() {
            return "double";
        }
    }

    record VoidType() implements IrType {
        @Override
        public String render() {
            return "void";
        }
    }

    record PointerType(IrType pointee) implements IrType {
        @Override
        public String render() {
            return pointee.render() + "*";
        }
    }

    record ArrayType(int length, IrType element) implements IrType {
        @Override
        public String render() {
            return "[" + length + " x " + element.render() + "]";
        }
    }
}
