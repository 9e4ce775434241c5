package org.automatic.compiler.frontend.parser.ast;

import org.automatic.compiler.frontend.lexer.Token;

/**
 * A use of a variable.
 *
 * @param identifierToken The token of the identifier.
 */
public record IdentifierNode(Token identifierToken) implements ExpressionNode {

    /**
     * @return The variable name.
     */
    public String name() {
        return identifierToken.text();
    }

    @Override
    public Token anchor() {
        return identifierToken;
    }
}
