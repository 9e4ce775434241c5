package org.automatic.compiler.ir;

/**
 * Two-operand arithmetic and bitwise instructions.
 */
public enum BinaryOpcode {
    ADD("add"), SUB("sub"), MUL("mul"), SDIV("sdiv"),
    FADD("fadd"), FSUB("fsub"), FMUL("fmul"), FDIV("fdiv"),
    AND("and"), OR("or"), XOR("xor");

    private final String mnemonic;

    BinaryOpcode(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    public String mnemonic() {
        return mnemonic;
    }
}
