package org.automatic.compiler.frontend.parser.ast;

import org.automatic.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * An assignment {@code NAME = value}. Its value is the assigned value.
 *
 * @param target The token of the assigned variable.
 * @param value The assigned expression.
 */
public record AssignNode(Token target, ExpressionNode value) implements ExpressionNode {

    @Override
    public Token anchor() {
        return target;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }
}
