package org.automatic.compiler.frontend.semantics.tree;

import org.automatic.compiler.types.Type;

/**
 * A zero-initialised global variable.
 *
 * @param type The declared type.
 * @param name The name.
 */
public record GlobalVariable(Type type, String name) {
}
