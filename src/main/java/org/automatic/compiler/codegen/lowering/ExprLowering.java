package org.automatic.compiler.codegen.lowering;

import org.automatic.compiler.codegen.FunctionGenContext;
import org.automatic.compiler.codegen.IStatementLowering;
import org.automatic.compiler.frontend.semantics.tree.Statement;

public final class ExprLowering implements IStatementLowering<Statement.Expr> {

    @Override
    public void lower(Statement.Expr statement, FunctionGenContext ctx) {
        ctx.lower(statement.expression());
    }
}
