package org.automatic.compiler.codegen;

import org.automatic.compiler.ir.IrFunction;
import org.automatic.compiler.ir.IrFunctionDeclaration;
import org.automatic.compiler.ir.IrGlobal;
import org.automatic.compiler.ir.IrModule;
import org.automatic.compiler.ir.IrType;
import org.automatic.compiler.ir.IrValue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Module-level state of one code generation run: global variables, function headers,
 * string and matrix constants, and external declarations. Constants are created on first use
 * and deduplicated by content.
 */
public final class ModuleContext {

    /** The name of the C library function the print built-ins call. */
    public static final String PRINTF = "printf";

    /**
     * The IR view of a user function, known before any body is generated.
     *
     * @param irName The IR function name.
     * @param returnType The IR return type.
     * @param parameterTypes The IR parameter types.
     */
    public record FunctionHeader(String irName, IrType returnType, List<IrType> parameterTypes) {}

    private final String moduleName;
    private final IrTypeMapper types;
    private final NameAllocator names = new NameAllocator();
    private final List<IrGlobal> globals = new ArrayList<>();
    private final List<IrFunctionDeclaration> declarations = new ArrayList<>();
    private final List<IrFunction> functions = new ArrayList<>();
    private final Map<String, IrValue.Global> globalVariables = new HashMap<>();
    private final Map<String, FunctionHeader> functionHeaders = new LinkedHashMap<>();
    private final Map<String, IrValue> stringConstants = new HashMap<>();
    private IrFunctionDeclaration printf;

    public ModuleContext(String moduleName, IrTypeMapper types) {
        this.moduleName = moduleName;
        this.types = types;
        names.reserve(PRINTF);
    }

    public IrTypeMapper types() {
        return types;
    }

    /**
     * Declares a user function so that calls can be generated before its body.
     * @param name The source name.
     * @param header The header, whose IR name is replaced by a unique one.
     * @return The registered header.
     */
    public FunctionHeader declareFunction(String name, FunctionHeader header) {
        FunctionHeader registered = new FunctionHeader(names.fresh(name), header.returnType(), header.parameterTypes());
        functionHeaders.put(name, registered);
        return registered;
    }

    /**
     * @param name The source name.
     * @return The header of that function.
     */
    public FunctionHeader function(String name) {
        FunctionHeader header = functionHeaders.get(name);
        if (header == null) {
            throw types.internal("Call of undeclared function '" + name + "'.");
        }
        return header;
    }

    /**
     * Defines a zero-initialised global variable.
     * @param name The source name.
     * @param initializer The zero value of its type.
     */
    public void defineGlobalVariable(String name, IrValue initializer) {
        IrGlobal global = new IrGlobal(names.fresh(name), initializer, false);
        globals.add(global);
        globalVariables.put(name, global.address());
    }

    /**
     * @param name The source name.
     * @return The address of the global variable, or {@code null}.
     */
    public IrValue.Global globalVariable(String name) {
        return globalVariables.get(name);
    }

    /**
     * @param text The string content.
     * @return An {@code i8*} to a private NUL-terminated copy of the text.
     */
    public IrValue stringConstant(String text) {
        return stringConstants.computeIfAbsent(text, t -> {
            IrValue.ConstString content = new IrValue.ConstString(t);
            IrGlobal global = new IrGlobal(names.fresh(".str"), content, true);
            globals.add(global);
            return new IrValue.StringPointer(global.address(), (IrType.ArrayType) content.type());
        });
    }

    /**
     * @param elements The constant element array.
     * @return The address of a private constant holding it.
     */
    public IrValue.Global matrixConstant(IrValue.ConstArray elements) {
        IrGlobal global = new IrGlobal(names.fresh(".matrix"), elements, true);
        globals.add(global);
        return global.address();
    }

    /**
     * @return The declaration of {@code printf}, added to the module on first use.
     */
    public IrFunctionDeclaration printf() {
        if (printf == null) {
            printf = new IrFunctionDeclaration(PRINTF, IrType.I32, List.of(IrType.I8_PTR), true);
            declarations.add(printf);
        }
        return printf;
    }

    /**
     * @param function A completed function.
     */
    public void addFunction(IrFunction function) {
        functions.add(function);
    }

    /**
     * @return The finished module.
     */
    public IrModule build() {
        return new IrModule(moduleName, List.copyOf(globals), List.copyOf(declarations), List.copyOf(functions));
    }
}
