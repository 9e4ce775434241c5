package org.automatic.compiler.ir;

import java.util.stream.Collectors;

/**
 * Renders an {@link IrModule} as LLVM-style textual IR. The output depends only on the module,
 * so equal modules print identically.
 */
public final class IrPrinter {

    private IrPrinter() {}

    /**
     * @param module The module.
     * @return The IR text.
     */
    public static String print(IrModule module) {
        StringBuilder sb = new StringBuilder();
        sb.append("; ModuleID = '").append(module.name()).append("'\n");
        sb.append("source_filename = \"").append(module.name()).append("\"\n");

        if (!module.globals().isEmpty()) {
            sb.append('\n');
            for (IrGlobal global : module.globals()) {
                sb.append(global(global)).append('\n');
            }
        }
        if (!module.declarations().isEmpty()) {
            sb.append('\n');
            for (IrFunctionDeclaration declaration : module.declarations()) {
                sb.append("declare ").append(declaration.returnType().render()).append(" @")
                        .append(declaration.name()).append(declaration.signature()).append('\n');
            }
        }
        for (IrFunction function : module.functions()) {
            sb.append('\n').append(function(function));
        }
        return sb.toString();
    }

    static String global(IrGlobal global) {
        String kind = global.constant() ? "private unnamed_addr constant " : "global ";
        return "@" + global.name() + " = " + kind + global.initializer().typed();
    }

    static String function(IrFunction function) {
        StringBuilder sb = new StringBuilder();
        String params = function.parameters().stream()
                .map(p -> p.value().typed())
                .collect(Collectors.joining(", "));
        sb.append("define ").append(function.returnType().render()).append(" @").append(function.name())
                .append('(').append(params).append(") {\n");
        boolean first = true;
        for (IrBasicBlock block : function.blocks()) {
            if (!first) sb.append('\n');
            first = false;
            sb.append(block.label()).append(":\n");
            for (IrInstruction instruction : block.instructions()) {
                sb.append("  ").append(instruction.render()).append('\n');
            }
        }
        return sb.append("}\n").toString();
    }
}
