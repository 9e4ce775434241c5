package org.automatic.compiler.ir;

import java.util.List;

/**
 * A defined function. The first block is the entry block.
 *
 * @param name The function name without {@code @}.
 * @param returnType The return type.
 * @param parameters The formals.
 * @param blocks The basic blocks in emission order.
 */
public record IrFunction(String name, IrType returnType, List<IrParameter> parameters, List<IrBasicBlock> blocks) {
}
