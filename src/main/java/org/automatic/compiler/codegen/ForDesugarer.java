package org.automatic.compiler.codegen;

import org.automatic.compiler.frontend.semantics.tree.Statement;

import java.util.List;

/**
 * Rewrites FOR into WHILE: {@code FOR(i; c; u) b} becomes {@code { i; WHILE (c) { b; u; } }}.
 * Init runs once; condition, body and update repeat in that order. Both blocks keep the loop's
 * scope, so the clauses resolve exactly as they did during analysis.
 */
public final class ForDesugarer {

    private ForDesugarer() {}

    /**
     * @param loop The FOR statement.
     * @return The equivalent block.
     */
    public static Statement.Block desugar(Statement.For loop) {
        Statement.Block iteration = new Statement.Block(
                List.of(loop.body(), new Statement.Expr(loop.update())), loop.scopeId());
        return new Statement.Block(
                List.of(new Statement.Expr(loop.init()), new Statement.While(loop.condition(), iteration)),
                loop.scopeId());
    }
}
