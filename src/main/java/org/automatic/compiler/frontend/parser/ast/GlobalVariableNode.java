package org.automatic.compiler.frontend.parser.ast;

import org.automatic.compiler.frontend.lexer.Token;

/**
 * A top-level variable declaration.
 *
 * @param type The declared type.
 * @param name The name token.
 */
public record GlobalVariableNode(TypeNode type, Token name) implements AstNode {
}
