package org.automatic.compiler.codegen.lowering;

import org.automatic.compiler.codegen.FunctionEmitter;
import org.automatic.compiler.codegen.FunctionGenContext;
import org.automatic.compiler.codegen.IStatementLowering;
import org.automatic.compiler.frontend.semantics.tree.Statement;
import org.automatic.compiler.ir.IrBasicBlock;
import org.automatic.compiler.ir.IrInstruction;
import org.automatic.compiler.ir.IrValue;

/**
 * Lowers IF into {@code then}, {@code else} and {@code merge} blocks. A branch falls through to
 * {@code merge} only if it did not end in a terminator of its own. A missing ELSE gives an
 * {@code else} block that only branches to {@code merge}.
 */
public final class IfLowering implements IStatementLowering<Statement.If> {

    @Override
    public void lower(Statement.If statement, FunctionGenContext ctx) {
        FunctionEmitter emitter = ctx.emitter();
        IrValue condition = ctx.lower(statement.condition());
        IrBasicBlock thenBlock = emitter.newBlock("then");
        IrBasicBlock elseBlock = emitter.newBlock("else");
        IrBasicBlock mergeBlock = emitter.newBlock("merge");
        emitter.emit(new IrInstruction.CondBr(condition, thenBlock.label(), elseBlock.label()));

        emitter.positionAt(thenBlock);
        ctx.lower(statement.thenBranch());
        emitter.branchIfOpen(mergeBlock);

        emitter.positionAt(elseBlock);
        if (statement.elseBranch() != null) {
            ctx.lower(statement.elseBranch());
        }
        emitter.branchIfOpen(mergeBlock);

        emitter.positionAt(mergeBlock);
    }
}
