package org.automatic.compiler.frontend.parser.ast;

import org.automatic.compiler.frontend.lexer.Token;

/**
 * An integer literal.
 *
 * @param token The first token of the literal.
 * @param value The literal value.
 */
public record IntegerLiteralNode(Token token, int value) implements ExpressionNode {

    @Override
    public Token anchor() {
        return token;
    }
}
