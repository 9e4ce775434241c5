package org.automatic.compiler.frontend.parser.ast;

import org.automatic.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A prefix operation.
 *
 * @param operatorToken The operator token.
 * @param operator The operator.
 * @param operand The operand.
 */
public record UnaryOpNode(Token operatorToken, UnaryOperator operator, ExpressionNode operand) implements ExpressionNode {

    @Override
    public Token anchor() {
        return operatorToken;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }
}
