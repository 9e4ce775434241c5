package org.automatic.compiler.frontend.preprocessor;

import org.automatic.compiler.frontend.lexer.Token;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The state shared by all directive handlers during one compilation:
 * the macro table, the units spliced so far and the stack of open conditionals.
 * A fresh context is created for every compilation.
 */
public class PreProcessorContext {
    private final Map<String, MacroDefinition> macroTable = new LinkedHashMap<>();
    private final Set<String> includedUnits = new LinkedHashSet<>();
    private final Deque<Token> openConditionals = new ArrayDeque<>();

    /**
     * Registers a macro definition, replacing an earlier one with the same name.
     * @param macro The macro definition to register.
     */
    public void registerMacro(MacroDefinition macro) {
        macroTable.put(macro.name().text(), macro);
    }

    /**
     * Removes a macro definition.
     * @param name The name of the macro.
     * @return {@code true} if the macro was defined.
     */
    public boolean removeMacro(String name) {
        return macroTable.remove(name) != null;
    }

    /**
     * Gets a macro definition by its name.
     * @param name The name of the macro.
     * @return An {@link Optional} containing the macro definition if it exists, otherwise empty.
     */
    public Optional<MacroDefinition> getMacro(String name) {
        return Optional.ofNullable(macroTable.get(name));
    }

    /**
     * @param name The name of the macro.
     * @return {@code true} if the name is currently defined.
     */
    public boolean isDefined(String name) {
        return macroTable.containsKey(name);
    }

    /**
     * Records a unit as spliced.
     * @param logicalName The logical name of the unit.
     * @return {@code false} if the unit had been spliced before.
     */
    public boolean markIncluded(String logicalName) {
        return includedUnits.add(logicalName);
    }

    /**
     * @return The logical names of all units seen, in inclusion order.
     */
    public Set<String> getIncludedUnits() {
        return includedUnits;
    }

    /**
     * Opens a conditional whose region is being included.
     * @param directive The {@code #IFDEF}/{@code #IFNDEF} token.
     */
    public void openConditional(Token directive) {
        openConditionals.push(directive);
    }

    /**
     * Closes the innermost open conditional.
     * @return The directive that opened it, or empty if none is open.
     */
    public Optional<Token> closeConditional() {
        return Optional.ofNullable(openConditionals.poll());
    }

    /**
     * @return The innermost open conditional, or empty if none is open.
     */
    public Optional<Token> innermostConditional() {
        return Optional.ofNullable(openConditionals.peek());
    }
}
