package org.automatic.compiler.frontend.parser.ast;

import org.automatic.compiler.frontend.lexer.Token;

/**
 * TRUE or FALSE.
 *
 * @param token The first token of the literal.
 * @param value The literal value.
 */
public record BoolLiteralNode(Token token, boolean value) implements ExpressionNode {

    @Override
    public Token anchor() {
        return token;
    }
}
