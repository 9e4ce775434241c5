package org.automatic.compiler.api;

import org.automatic.compiler.ir.IrModule;
import org.automatic.compiler.ir.IrPrinter;

/**
 * The result of a successful compilation.
 *
 * @param programName The logical name of the compiled main unit.
 * @param module The generated IR module.
 */
public record ProgramArtifact(String programName, IrModule module) {

    /**
     * @return The module rendered as IR text.
     */
    public String irText() {
        return IrPrinter.print(module);
    }
}
