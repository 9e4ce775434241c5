package org.automatic.compiler.ir;

/**
 * A global variable or a private constant.
 *
 * @param name The name without {@code @}.
 * @param initializer The initial value; its type is the type of the global.
 * @param constant {@code true} for read-only private data such as strings and matrix literals.
 */
public record IrGlobal(String name, IrValue initializer, boolean constant) {

    /**
     * @return The address of this global.
     */
    public IrValue.Global address() {
        return new IrValue.Global(initializer.type().pointer(), name);
    }
}
