package org.automatic.compiler.frontend.semantics;

import org.automatic.compiler.types.Type;

import java.util.List;

/**
 * The callable view of a user function.
 *
 * @param name The function name.
 * @param returnType The declared return type.
 * @param parameterTypes The formal parameter types in order.
 */
public record FunctionSignature(String name, Type returnType, List<Type> parameterTypes) {
}
