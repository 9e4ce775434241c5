package org.automatic.compiler.frontend.parser.ast;

import org.automatic.compiler.frontend.lexer.Token;

/**
 * A string literal without its quotes.
 *
 * @param token The first token of the literal.
 * @param value The literal value.
 */
public record StringLiteralNode(Token token, String value) implements ExpressionNode {

    @Override
    public Token anchor() {
        return token;
    }
}
