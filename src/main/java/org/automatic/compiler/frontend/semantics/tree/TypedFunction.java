package org.automatic.compiler.frontend.semantics.tree;

import org.automatic.compiler.types.Type;

import java.util.List;

/**
 * An analyzed function.
 *
 * @param name The function name.
 * @param parameters The formals in order.
 * @param returnType The return type, never AUTO.
 * @param body The body. Its scope is the one the formals are declared in.
 */
public record TypedFunction(String name, List<Parameter> parameters, Type returnType, Statement.Block body) {

    /**
     * A formal parameter.
     *
     * @param type The declared type.
     * @param name The name.
     */
    public record Parameter(Type type, String name) {}
}
