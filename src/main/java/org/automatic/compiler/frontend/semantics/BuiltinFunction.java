package org.automatic.compiler.frontend.semantics;

import java.util.Arrays;
import java.util.Optional;

/**
 * The built-in pseudo-functions. Each takes exactly one argument.
 */
public enum BuiltinFunction {
    /** Prints an INT, BOOL or FLOAT followed by a line-end. */
    PRINT,
    /** Prints a STRING followed by a line-end. */
    PRINTSTR,
    /** The number of rows of a matrix, 0 for a null matrix. */
    ROWS,
    /** The number of columns of a matrix, 0 for a null matrix. */
    COLS;

    /**
     * @param name A callee name.
     * @return The built-in of that name, if any.
     */
    public static Optional<BuiltinFunction> byName(String name) {
        return Arrays.stream(values()).filter(b -> b.name().equals(name)).findFirst();
    }
}
