package org.automatic.compiler.frontend.semantics.tree;

import org.automatic.compiler.types.Type;

/**
 * An expression together with the type the analyzer resolved for it.
 * Code generation takes the type from here and never recomputes it.
 *
 * @param type The resolved type, never AUTO.
 * @param expression The expression.
 */
public record TypedExpression(Type type, Expression expression) {
}
