package org.automatic.compiler.frontend.parser.ast;

import org.automatic.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A binary operation.
 *
 * @param left The left operand.
 * @param operatorToken The first character token of the operator.
 * @param operator The operator.
 * @param right The right operand.
 */
public record BinaryOpNode(ExpressionNode left, Token operatorToken, BinaryOperator operator, ExpressionNode right)
        implements ExpressionNode {

    @Override
    public Token anchor() {
        return operatorToken;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
