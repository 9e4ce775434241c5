package org.automatic.compiler.frontend.parser.ast;

import org.automatic.compiler.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * A function definition.
 *
 * @param returnType The declared return type.
 * @param name The name token.
 * @param parameters The formal parameters in order.
 * @param body The statements of the body.
 */
public record FunctionNode(
        TypeNode returnType,
        Token name,
        List<ParameterNode> parameters,
        List<StatementNode> body
) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(parameters);
        children.addAll(body);
        return children;
    }
}
