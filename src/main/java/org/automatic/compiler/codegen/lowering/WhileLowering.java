package org.automatic.compiler.codegen.lowering;

import org.automatic.compiler.codegen.FunctionEmitter;
import org.automatic.compiler.codegen.FunctionGenContext;
import org.automatic.compiler.codegen.IStatementLowering;
import org.automatic.compiler.frontend.semantics.tree.Statement;
import org.automatic.compiler.ir.IrBasicBlock;
import org.automatic.compiler.ir.IrInstruction;
import org.automatic.compiler.ir.IrValue;

/**
 * Lowers WHILE into {@code while} (the predicate), {@code while_body} and {@code merge} blocks.
 * The predicate is tested before every iteration, including the first.
 */
public final class WhileLowering implements IStatementLowering<Statement.While> {

    @Override
    public void lower(Statement.While loop, FunctionGenContext ctx) {
        FunctionEmitter emitter = ctx.emitter();
        IrBasicBlock predicateBlock = emitter.newBlock("while");
        IrBasicBlock bodyBlock = emitter.newBlock("while_body");
        IrBasicBlock mergeBlock = emitter.newBlock("merge");

        emitter.branchIfOpen(predicateBlock);
        emitter.positionAt(predicateBlock);
        IrValue condition = ctx.lower(loop.condition());
        emitter.emit(new IrInstruction.CondBr(condition, bodyBlock.label(), mergeBlock.label()));

        emitter.positionAt(bodyBlock);
        ctx.lower(loop.body());
        emitter.branchIfOpen(predicateBlock);

        emitter.positionAt(mergeBlock);
    }
}
