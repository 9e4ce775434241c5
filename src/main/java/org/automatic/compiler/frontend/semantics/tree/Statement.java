package org.automatic.compiler.frontend.semantics.tree;

import org.automatic.compiler.types.Type;

import java.util.List;

/**
 * The statement forms of the typed tree. Statements that open a scope carry the scope's id in
 * the {@link org.automatic.compiler.frontend.semantics.SymbolTable}.
 */
public sealed interface Statement {

    record Block(List<Statement> statements, int scopeId) implements Statement {}

    /**
     * A local variable declaration.
     *
     * @param type The resolved type, never AUTO.
     * @param name The variable name.
     * @param initializer The initial value, or {@code null} for the zero value.
     */
    record VarDecl(Type type, String name, TypedExpression initializer) implements Statement {}

    record Expr(TypedExpression expression) implements Statement {}

    /**
     * @param value The returned value, a {@link Expression.NoExpr} in VOID functions.
     */
    record Return(TypedExpression value) implements Statement {}

    /**
     * @param elseBranch The ELSE branch, or {@code null}.
     */
    record If(TypedExpression condition, Statement thenBranch, Statement elseBranch) implements Statement {}

    record While(TypedExpression condition, Statement body) implements Statement {}

    /**
     * A FOR loop. Code generation rewrites it into a block around a {@link While} before lowering.
     *
     * @param scopeId The scope holding the loop clauses.
     */
    record For(TypedExpression init, TypedExpression condition, TypedExpression update, Statement body, int scopeId)
            implements Statement {}
}
