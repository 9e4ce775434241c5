package org.automatic.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An expression evaluated for its effect. The empty statement {@code ;} holds a {@link NoExprNode}.
 *
 * @param expression The expression.
 */
public record ExpressionStatementNode(ExpressionNode expression) implements StatementNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }
}
