package org.automatic.compiler.frontend.parser.ast;

import org.automatic.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * An IF statement.
 *
 * @param keyword The IF token.
 * @param condition The condition.
 * @param thenBranch The statement executed if the condition holds.
 * @param elseBranch The ELSE statement, or {@code null}.
 */
public record IfNode(Token keyword, ExpressionNode condition, StatementNode thenBranch, StatementNode elseBranch)
        implements StatementNode {

    @Override
    public List<AstNode> getChildren() {
        return elseBranch == null ? List.of(condition, thenBranch) : List.of(condition, thenBranch, elseBranch);
    }
}
