package org.automatic.compiler.codegen.lowering;

import org.automatic.compiler.codegen.FunctionGenContext;
import org.automatic.compiler.codegen.IStatementLowering;
import org.automatic.compiler.frontend.semantics.tree.Statement;
import org.automatic.compiler.ir.IrInstruction;
import org.automatic.compiler.ir.IrType;

public final class ReturnLowering implements IStatementLowering<Statement.Return> {

    @Override
    public void lower(Statement.Return ret, FunctionGenContext ctx) {
        if (ctx.emitter().returnType().equals(IrType.VOID)) {
            ctx.emitter().emit(new IrInstruction.Ret(null));
            return;
        }
        ctx.emitter().emit(new IrInstruction.Ret(ctx.lower(ret.value())));
    }
}
