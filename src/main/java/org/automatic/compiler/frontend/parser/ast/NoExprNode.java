package org.automatic.compiler.frontend.parser.ast;

import org.automatic.compiler.frontend.lexer.Token;

/**
 * The empty expression: an omitted FOR init or update, a bare RETURN, an empty statement.
 *
 * @param position The token where the expression was omitted.
 */
public record NoExprNode(Token position) implements ExpressionNode {

    @Override
    public Token anchor() {
        return position;
    }
}
