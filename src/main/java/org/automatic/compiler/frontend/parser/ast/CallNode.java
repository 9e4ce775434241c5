package org.automatic.compiler.frontend.parser.ast;

import org.automatic.compiler.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * A call of a user function or a built-in.
 *
 * @param callee The token of the function name.
 * @param arguments The arguments in order.
 */
public record CallNode(Token callee, List<ExpressionNode> arguments) implements ExpressionNode {

    @Override
    public Token anchor() {
        return callee;
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(arguments);
    }
}
