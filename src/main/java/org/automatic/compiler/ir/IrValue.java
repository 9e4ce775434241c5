package org.automatic.compiler.ir;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * An operand of an IR instruction or the initializer of a global.
 */
public sealed interface IrValue {

    /**
     * @return The type of the value.
     */
    IrType type();

    /**
     * @return The value as written in operand position, without its type.
     */
    String render();

    /**
     * @return The value preceded by its type, e.g. {@code i32 %X}.
     */
    default String typed() {
        return type().render() + " " + render();
    }

    /**
     * An integer constant. {@code i1} constants render as {@code true}/{@code false}.
     */
    record ConstInt(IrType type, long value) implements IrValue {
        @Override
        public String render() {
            if (type.equals(IrType.I1)) {
                return value != 0 ? "true" : "false";
            }
            return Long.toString(value);
        }
    }

    /**
     * A double constant, rendered in the exact hexadecimal form.
     */
    record ConstFloat(double value) implements IrValue {
        @Override
        public IrType type() {
            return IrType.DOUBLE;
        }

        @Override
        public String render() {
            return "0x" + String.format(Locale.ROOT, "%016X", Double.doubleToRawLongBits(value));
        }
    }

    record Null(IrType type) implements IrValue {
        @Override
        public String render() {
            return "null";
        }
    }

    /**
     * A constant array; {@code elements} must all have the array's element type.
     */
    record ConstArray(IrType.ArrayType type, List<IrValue> elements) implements IrValue {
        @Override
        public String render() {
            return elements.stream().map(IrValue::typed).collect(Collectors.joining(", ", "[", "]"));
        }
    }

    /**
     * A NUL-terminated byte string constant. Bytes outside printable ASCII, quotes and
     * backslashes are written as hex escapes.
     */
    record ConstString(String text) implements IrValue {
        @Override
        public IrType type() {
            return new IrType.ArrayType(bytes().length + 1, IrType.I8);
        }

        @Override
        public String render() {
            StringBuilder sb = new StringBuilder("c\"");
            for (byte b : bytes()) {
                int c = b & 0xFF;
                if (c >= 0x20 && c < 0x7F && c != '"' && c != '\\') {
                    sb.append((char) c);
                } else {
                    sb.append('\\').append(String.format(Locale.ROOT, "%02X", c));
                }
            }
            return sb.append("\\00\"").toString();
        }

        private byte[] bytes() {
            return text.getBytes(StandardCharsets.UTF_8);
        }
    }

    /**
     * A virtual register of a function.
     */
    record Local(IrType type, String name) implements IrValue {
        @Override
        public String render() {
            return "%" + name;
        }
    }

    /**
     * The address of a global or function; {@code type} is a pointer type.
     */
    record Global(IrType type, String name) implements IrValue {
        @Override
        public String render() {
            return "@" + name;
        }
    }

    /**
     * The address of the first byte of a global string constant.
     */
    record StringPointer(Global constant, IrType.ArrayType arrayType) implements IrValue {
        @Override
        public IrType type() {
            return IrType.I8_PTR;
        }

        @Override
        public String render() {
            return "getelementptr inbounds (" + arrayType.render() + ", " + constant.typed() + ", i32 0, i32 0)";
        }
    }
}
