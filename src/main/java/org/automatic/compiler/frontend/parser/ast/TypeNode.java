package org.automatic.compiler.frontend.parser.ast;

import org.automatic.compiler.frontend.lexer.Token;
import org.automatic.compiler.types.Type;

/**
 * A type as written in the source. The type is not validated yet: it may be AUTO,
 * VOID, or a matrix of a type that cannot be a matrix element.
 *
 * @param token The first token of the type.
 * @param type The source-level type.
 */
public record TypeNode(Token token, Type type) implements AstNode {
}
