package org.automatic.compiler.frontend.parser.ast;

import org.automatic.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A FOR loop. Omitted parts are filled in by the parser: a missing condition is TRUE,
 * a missing init or update is a {@link NoExprNode}.
 *
 * @param keyword The FOR token.
 * @param init Evaluated once before the loop.
 * @param condition Tested before every iteration.
 * @param update Evaluated after every iteration.
 * @param body The loop body.
 */
public record ForNode(Token keyword, ExpressionNode init, ExpressionNode condition, ExpressionNode update, StatementNode body)
        implements StatementNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(init, condition, update, body);
    }
}
