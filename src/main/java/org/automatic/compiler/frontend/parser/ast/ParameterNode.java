package org.automatic.compiler.frontend.parser.ast;

import org.automatic.compiler.frontend.lexer.Token;

/**
 * A formal parameter of a function.
 *
 * @param type The declared type.
 * @param name The name token.
 */
public record ParameterNode(TypeNode type, Token name) implements AstNode {
}
