package org.automatic.compiler.frontend.parser.ast;

import org.automatic.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A RETURN statement.
 *
 * @param keyword The RETURN token.
 * @param value The returned value, a {@link NoExprNode} for a bare RETURN.
 */
public record ReturnNode(Token keyword, ExpressionNode value) implements StatementNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }
}
