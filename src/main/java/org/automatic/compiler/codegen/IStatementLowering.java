package org.automatic.compiler.codegen;

import org.automatic.compiler.frontend.semantics.tree.Statement;

/**
 * Lowers one kind of typed statement into IR.
 * <p>
 * Implementations are stateless. All output goes through the {@link FunctionGenContext}.
 *
 * @param <T> The statement type handled by this lowering.
 */
public interface IStatementLowering<T extends Statement> {

    /**
     * Emits the IR for a statement at the current insertion point.
     *
     * @param statement The statement.
     * @param ctx The generation context of the enclosing function.
     */
    void lower(T statement, FunctionGenContext ctx);
}
