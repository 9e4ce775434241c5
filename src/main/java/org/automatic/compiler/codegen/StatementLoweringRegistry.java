package org.automatic.compiler.codegen;

import org.automatic.compiler.codegen.lowering.BlockLowering;
import org.automatic.compiler.codegen.lowering.ExprLowering;
import org.automatic.compiler.codegen.lowering.ForLowering;
import org.automatic.compiler.codegen.lowering.IfLowering;
import org.automatic.compiler.codegen.lowering.ReturnLowering;
import org.automatic.compiler.codegen.lowering.VarDeclLowering;
import org.automatic.compiler.codegen.lowering.WhileLowering;
import org.automatic.compiler.diagnostics.DiagnosticsEngine;
import org.automatic.compiler.api.CompilerErrorCode;
import org.automatic.compiler.frontend.semantics.tree.Statement;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps each typed statement class to its lowering. A statement class without a lowering is an
 * internal error.
 */
public final class StatementLoweringRegistry {

    private final Map<Class<? extends Statement>, IStatementLowering<? extends Statement>> byClass = new HashMap<>();
    private final DiagnosticsEngine diagnostics;

    private StatementLoweringRegistry(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Registers a lowering for the given statement class.
     *
     * @param statementType The statement class.
     * @param lowering The lowering handling that class.
     * @param <T> Statement type parameter.
     */
    public <T extends Statement> void register(Class<T> statementType, IStatementLowering<T> lowering) {
        byClass.put(statementType, lowering);
    }

    /**
     * Resolves the lowering for a statement.
     *
     * @param statement The statement.
     * @return Its lowering.
     */
    @SuppressWarnings("unchecked")
    public IStatementLowering<Statement> resolve(Statement statement) {
        IStatementLowering<?> found = byClass.get(statement.getClass());
        if (found == null) {
            throw diagnostics.abort(CompilerErrorCode.INTERNAL_ERROR,
                    "No lowering for " + statement.getClass().getSimpleName() + ".", "<codegen>", 0);
        }
        return (IStatementLowering<Statement>) found;
    }

    /**
     * Initializes a registry with all built-in lowerings.
     *
     * @param diagnostics The engine that records internal errors.
     * @return A registry with one lowering per statement form.
     */
    public static StatementLoweringRegistry initializeWithDefaults(DiagnosticsEngine diagnostics) {
        StatementLoweringRegistry reg = new StatementLoweringRegistry(diagnostics);
        reg.register(Statement.Block.class, new BlockLowering());
        reg.register(Statement.VarDecl.class, new VarDeclLowering());
        reg.register(Statement.Expr.class, new ExprLowering());
        reg.register(Statement.Return.class, new ReturnLowering());
        reg.register(Statement.If.class, new IfLowering());
        reg.register(Statement.While.class, new WhileLowering());
        reg.register(Statement.For.class, new ForLowering());
        return reg;
    }
}
