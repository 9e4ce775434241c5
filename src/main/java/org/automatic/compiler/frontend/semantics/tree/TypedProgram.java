package org.automatic.compiler.frontend.semantics.tree;

import java.util.List;

/**
 * The output of semantic analysis: globals and functions in source order.
 *
 * @param globals The global variables.
 * @param functions The functions.
 */
public record TypedProgram(List<GlobalVariable> globals, List<TypedFunction> functions) {
}
