package org.automatic.compiler.codegen.lowering;

import org.automatic.compiler.codegen.ForDesugarer;
import org.automatic.compiler.codegen.FunctionGenContext;
import org.automatic.compiler.codegen.IStatementLowering;
import org.automatic.compiler.frontend.semantics.tree.Statement;

/**
 * FOR has no lowering of its own: it is rewritten by the {@link ForDesugarer} and the result lowered.
 */
public final class ForLowering implements IStatementLowering<Statement.For> {

    @Override
    public void lower(Statement.For loop, FunctionGenContext ctx) {
        ctx.lower(ForDesugarer.desugar(loop));
    }
}
