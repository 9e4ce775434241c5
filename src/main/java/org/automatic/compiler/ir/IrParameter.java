package org.automatic.compiler.ir;

/**
 * A formal parameter of an IR function.
 *
 * @param value The register that holds the incoming argument.
 */
public record IrParameter(IrValue.Local value) {
}
