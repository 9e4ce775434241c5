package org.automatic.compiler.frontend.parser.ast;

import org.automatic.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A local variable declaration.
 *
 * @param type The declared type, possibly AUTO.
 * @param name The name token.
 * @param initializer The initializer, or {@code null} if there is none.
 */
public record VarDeclNode(TypeNode type, Token name, ExpressionNode initializer) implements StatementNode {

    @Override
    public List<AstNode> getChildren() {
        return initializer == null ? List.of() : List.of(initializer);
    }
}
