package org.automatic.compiler.frontend.semantics;

import org.automatic.compiler.types.Type;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A symbol table for variables and functions.
 * <p>
 * Variable scopes are kept in an arena and referred to by their integer id; each scope knows
 * the id of its parent. Scope 0 is the global scope. Typed statements that open a scope carry
 * its id, so the tree never holds references to scope objects.
 * <p>
 * Functions live in a namespace of their own, so a variable and a function may share a name.
 */
public class SymbolTable {

    /** The id of the global scope. */
    public static final int GLOBAL_SCOPE = 0;

    /** Marks the absence of a parent scope. */
    public static final int NO_PARENT = -1;

    /**
     * One scope in the arena.
     *
     * @param id The id of this scope.
     * @param parentId The id of the enclosing scope, or {@link #NO_PARENT}.
     * @param symbols The variables declared in this scope, in declaration order.
     */
    public record Scope(int id, int parentId, Map<String, Type> symbols) {}

    private final List<Scope> scopes = new ArrayList<>();
    private final Map<String, FunctionSignature> functions = new LinkedHashMap<>();

    /**
     * Constructs a symbol table containing only the empty global scope.
     */
    public SymbolTable() {
        scopes.add(new Scope(GLOBAL_SCOPE, NO_PARENT, new LinkedHashMap<>()));
    }

    /**
     * Creates a new scope nested in another one.
     * @param parentId The id of the enclosing scope.
     * @return The id of the new scope.
     */
    public int createScope(int parentId) {
        int id = scopes.size();
        scopes.add(new Scope(id, parentId, new LinkedHashMap<>()));
        return id;
    }

    /**
     * Declares a variable in a scope.
     * @param scopeId The scope.
     * @param name The variable name.
     * @param type The resolved type.
     * @return {@code false} if the scope already declares that name.
     */
    public boolean declare(int scopeId, String name, Type type) {
        return scopes.get(scopeId).symbols().putIfAbsent(name, type) == null;
    }

    /**
     * Resolves a variable, walking from the given scope outwards. The innermost declaration wins.
     * @param scopeId The scope of the use.
     * @param name The variable name.
     * @return The type of the variable, or empty if it is not declared.
     */
    public Optional<Type> lookup(int scopeId, String name) {
        for (int id = scopeId; id != NO_PARENT; id = scopes.get(id).parentId()) {
            Type type = scopes.get(id).symbols().get(name);
            if (type != null) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * @param scopeId The scope id.
     * @return The scope record.
     */
    public Scope getScope(int scopeId) {
        return scopes.get(scopeId);
    }

    /**
     * @return The number of scopes created so far.
     */
    public int scopeCount() {
        return scopes.size();
    }

    /**
     * Registers a function signature.
     * @param signature The signature.
     * @return {@code false} if a function of that name is already registered.
     */
    public boolean defineFunction(FunctionSignature signature) {
        return functions.putIfAbsent(signature.name(), signature) == null;
    }

    /**
     * @param name The function name.
     * @return The signature, or empty if there is no such function.
     */
    public Optional<FunctionSignature> resolveFunction(String name) {
        return Optional.ofNullable(functions.get(name));
    }
}
