package org.automatic.compiler.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A labelled straight-line instruction sequence. A complete block ends with exactly one terminator.
 */
public final class IrBasicBlock {
    private final String label;
    private final List<IrInstruction> instructions = new ArrayList<>();

    public IrBasicBlock(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Appends an instruction.
     * @param instruction The instruction.
     * @throws IllegalStateException if the block is already terminated.
     */
    public void add(IrInstruction instruction) {
        if (isTerminated()) {
            throw new IllegalStateException("Block '" + label + "' already has a terminator.");
        }
        instructions.add(instruction);
    }

    /**
     * Inserts an instruction at a position, used for entry-block allocas.
     * @param index The position.
     * @param instruction The instruction.
     */
    public void insert(int index, IrInstruction instruction) {
        instructions.add(index, instruction);
    }

    /**
     * @return {@code true} if the last instruction is a terminator.
     */
    public boolean isTerminated() {
        return !instructions.isEmpty() && instructions.get(instructions.size() - 1).isTerminator();
    }

    public List<IrInstruction> instructions() {
        return Collections.unmodifiableList(instructions);
    }

    @Override
    public String toString() {
        return "IrBasicBlock{" + label + ", " + instructions.size() + " instructions}";
    }
}
