package org.automatic.compiler.codegen;

import org.automatic.compiler.ir.IrBasicBlock;
import org.automatic.compiler.ir.IrFunction;
import org.automatic.compiler.ir.IrInstruction;
import org.automatic.compiler.ir.IrParameter;
import org.automatic.compiler.ir.IrType;
import org.automatic.compiler.ir.IrValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the blocks of one function. The emitter owns the single mutable insertion point:
 * instructions go to the current block until {@link #positionAt} moves it.
 * <p>
 * Blocks join the function in the order they are positioned at. Storage is allocated at the
 * top of the entry block. Registers and block labels share one name space.
 */
public final class FunctionEmitter {

    private final String name;
    private final IrType returnType;
    private final List<IrParameter> parameters = new ArrayList<>();
    private final List<IrBasicBlock> blocks = new ArrayList<>();
    private final NameAllocator names = new NameAllocator();
    private final IrBasicBlock entry;
    private IrBasicBlock current;
    private int allocaCount = 0;

    /**
     * @param name The IR function name.
     * @param returnType The IR return type.
     */
    public FunctionEmitter(String name, IrType returnType) {
        this.name = name;
        this.returnType = returnType;
        this.entry = newBlock("entry");
        positionAt(entry);
    }

    /**
     * Adds a formal parameter.
     * @param type The IR type.
     * @param hint The preferred register name.
     * @return The register holding the argument.
     */
    public IrValue.Local addParameter(IrType type, String hint) {
        IrValue.Local value = new IrValue.Local(type, names.fresh(hint));
        parameters.add(new IrParameter(value));
        return value;
    }

    /**
     * Creates a block without positioning at it.
     * @param hint The preferred label.
     * @return The new block.
     */
    public IrBasicBlock newBlock(String hint) {
        return new IrBasicBlock(names.fresh(hint));
    }

    /**
     * Moves the insertion point to a block and appends the block to the function.
     * @param block A block not positioned at before.
     */
    public void positionAt(IrBasicBlock block) {
        blocks.add(block);
        current = block;
    }

    /**
     * @return {@code true} if the current block already ends in a terminator.
     */
    public boolean isTerminated() {
        return current.isTerminated();
    }

    /**
     * Appends an instruction to the current block. After a terminator, code is unreachable and
     * goes to a fresh block no branch leads to.
     * @param instruction The instruction.
     */
    public void emit(IrInstruction instruction) {
        if (current.isTerminated()) {
            positionAt(newBlock("unreachable"));
        }
        current.add(instruction);
    }

    /**
     * Branches to a block unless the current block is already terminated.
     * @param target The target block.
     */
    public void branchIfOpen(IrBasicBlock target) {
        if (!current.isTerminated()) {
            current.add(new IrInstruction.Br(target.label()));
        }
    }

    /**
     * @param type The IR type of the register.
     * @param hint The preferred name.
     * @return A fresh register.
     */
    public IrValue.Local newLocal(IrType type, String hint) {
        return new IrValue.Local(type, names.fresh(hint));
    }

    /**
     * Allocates stack storage at the top of the entry block.
     * @param type The type of the stored value.
     * @param hint The preferred name of the pointer register.
     * @return The pointer to the storage.
     */
    public IrValue.Local alloca(IrType type, String hint) {
        IrValue.Local pointer = newLocal(type.pointer(), hint);
        entry.insert(allocaCount++, new IrInstruction.Alloca(pointer, type));
        return pointer;
    }

    /**
     * @return The IR return type.
     */
    public IrType returnType() {
        return returnType;
    }

    /**
     * Completes the function. If control can fall off the end, the given return is added.
     * @param defaultReturn The return used when the last block is open.
     * @return The function.
     */
    public IrFunction finish(IrInstruction.Ret defaultReturn) {
        if (!current.isTerminated()) {
            current.add(defaultReturn);
        }
        return new IrFunction(name, returnType, List.copyOf(parameters), List.copyOf(blocks));
    }
}
