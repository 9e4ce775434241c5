package org.automatic.compiler.codegen.lowering;

import org.automatic.compiler.codegen.FunctionGenContext;
import org.automatic.compiler.codegen.IStatementLowering;
import org.automatic.compiler.frontend.semantics.tree.Statement;
import org.automatic.compiler.ir.IrInstruction;
import org.automatic.compiler.ir.IrValue;

/**
 * Lowers a local declaration into entry-block storage plus a store of the initial value.
 * Without an initializer the zero value of the type is stored, so every execution of the
 * declaration starts from the same value.
 */
public final class VarDeclLowering implements IStatementLowering<Statement.VarDecl> {

    @Override
    public void lower(Statement.VarDecl decl, FunctionGenContext ctx) {
        IrValue initial = decl.initializer() == null
                ? ctx.types().zeroValue(decl.type())
                : ctx.lower(decl.initializer());
        IrValue.Local storage = ctx.emitter().alloca(ctx.types().map(decl.type()), decl.name());
        ctx.emitter().emit(new IrInstruction.Store(initial, storage));
        ctx.bindLocal(decl.name(), storage);
    }
}
