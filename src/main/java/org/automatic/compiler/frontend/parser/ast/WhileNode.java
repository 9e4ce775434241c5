package org.automatic.compiler.frontend.parser.ast;

import org.automatic.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A WHILE loop.
 *
 * @param keyword The WHILE token.
 * @param condition The loop condition.
 * @param body The loop body.
 */
public record WhileNode(Token keyword, ExpressionNode condition, StatementNode body) implements StatementNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(condition, body);
    }
}
