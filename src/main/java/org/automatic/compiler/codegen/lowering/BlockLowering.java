package org.automatic.compiler.codegen.lowering;

import org.automatic.compiler.codegen.FunctionGenContext;
import org.automatic.compiler.codegen.IStatementLowering;
import org.automatic.compiler.frontend.semantics.tree.Statement;

/**
 * Lowers a block: its declarations live in a frame that is closed at the end of the block.
 */
public final class BlockLowering implements IStatementLowering<Statement.Block> {

    @Override
    public void lower(Statement.Block block, FunctionGenContext ctx) {
        ctx.pushFrame();
        for (Statement statement : block.statements()) {
            ctx.lower(statement);
        }
        ctx.popFrame();
    }
}
