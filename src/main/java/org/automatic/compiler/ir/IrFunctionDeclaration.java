package org.automatic.compiler.ir;

import java.util.List;

/**
 * An external function, e.g. {@code declare i32 @printf(i8*, ...)}.
 *
 * @param name The function name without {@code @}.
 * @param returnType The return type.
 * @param parameterTypes The fixed parameter types.
 * @param varArgs {@code true} if further arguments are accepted.
 */
public record IrFunctionDeclaration(String name, IrType returnType, List<IrType> parameterTypes, boolean varArgs) {

    /**
     * @return The function type without return type, e.g. {@code (i8*, ...)}.
     */
    public String signature() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < parameterTypes.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(parameterTypes.get(i).render());
        }
        if (varArgs) {
            sb.append(parameterTypes.isEmpty() ? "..." : ", ...");
        }
        return sb.append(")").toString();
    }
}
