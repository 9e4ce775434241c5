package org.automatic.compiler.frontend.parser.ast;

import org.automatic.compiler.frontend.lexer.Token;

/**
 * An AST node that produces a value.
 */
public interface ExpressionNode extends AstNode {
    /**
     * @return The token that best locates this expression in the source.
     */
    Token anchor();
}
