package org.automatic.compiler.ir;

import java.util.List;

/**
 * The IR of one program. The order of each list is the emission order and is preserved by the printer.
 *
 * @param name The module name.
 * @param globals Global variables and constants.
 * @param declarations External functions.
 * @param functions Defined functions.
 */
public record IrModule(String name, List<IrGlobal> globals, List<IrFunctionDeclaration> declarations, List<IrFunction> functions) {

    /**
     * @param functionName A function name.
     * @return The defined function of that name, or {@code null}.
     */
    public IrFunction function(String functionName) {
        return functions.stream().filter(f -> f.name().equals(functionName)).findFirst().orElse(null);
    }
}
