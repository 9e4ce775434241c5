package org.automatic.compiler.frontend.parser.ast;

import org.automatic.compiler.frontend.lexer.Token;

/**
 * A floating-point literal, written as digits, a dot and digits.
 *
 * @param token The first token of the literal.
 * @param value The literal value.
 */
public record FloatLiteralNode(Token token, double value) implements ExpressionNode {

    @Override
    public Token anchor() {
        return token;
    }
}
