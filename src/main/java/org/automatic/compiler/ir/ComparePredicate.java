package org.automatic.compiler.ir;

/**
 * Comparison predicates: signed integer ({@code icmp}) and ordered floating point ({@code fcmp}).
 */
public enum ComparePredicate {
    EQ("icmp", "eq"), NE("icmp", "ne"),
    SLT("icmp", "slt"), SLE("icmp", "sle"), SGT("icmp", "sgt"), SGE("icmp", "sge"),
    OEQ("fcmp", "oeq"), ONE("fcmp", "one"),
    OLT("fcmp", "olt"), OLE("fcmp", "ole"), OGT("fcmp", "ogt"), OGE("fcmp", "oge");

    private final String instruction;
    private final String condition;

    ComparePredicate(String instruction, String condition) {
        this.instruction = instruction;
        this.condition = condition;
    }

    /**
     * @return {@code icmp} or {@code fcmp}.
     */
    public String instruction() {
        return instruction;
    }

    /**
     * @return The condition code, e.g. {@code slt}.
     */
    public String condition() {
        return condition;
    }
}
