package org.automatic.compiler.codegen;

import org.automatic.compiler.diagnostics.CompilerAbortException;
import org.automatic.compiler.diagnostics.CompilerLogger;
import org.automatic.compiler.diagnostics.DiagnosticsEngine;
import org.automatic.compiler.frontend.semantics.tree.GlobalVariable;
import org.automatic.compiler.frontend.semantics.tree.Statement;
import org.automatic.compiler.frontend.semantics.tree.TypedFunction;
import org.automatic.compiler.frontend.semantics.tree.TypedProgram;
import org.automatic.compiler.ir.IrInstruction;
import org.automatic.compiler.ir.IrModule;
import org.automatic.compiler.ir.IrType;
import org.automatic.compiler.ir.IrValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers a typed program into an {@link IrModule}.
 * <p>
 * All functions are declared first, so bodies can call functions defined later. Globals get
 * zero-initialised storage. Each body is then generated in source order, which makes the output
 * a pure function of the typed program.
 */
public class CodeGenerator {

    private final DiagnosticsEngine diagnostics;
    private final StatementLoweringRegistry registry;

    /**
     * @param diagnostics The engine that records internal errors.
     */
    public CodeGenerator(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
        this.registry = StatementLoweringRegistry.initializeWithDefaults(diagnostics);
    }

    /**
     * Generates the module.
     * @param program The typed program.
     * @param moduleName The module name.
     * @return The IR module.
     * @throws CompilerAbortException on an internal error.
     */
    public IrModule generate(TypedProgram program, String moduleName) {
        IrTypeMapper types = new IrTypeMapper(diagnostics);
        ModuleContext module = new ModuleContext(moduleName, types);

        for (TypedFunction function : program.functions()) {
            List<IrType> parameterTypes = new ArrayList<>();
            for (TypedFunction.Parameter parameter : function.parameters()) {
                parameterTypes.add(types.map(parameter.type()));
            }
            module.declareFunction(function.name(),
                    new ModuleContext.FunctionHeader(function.name(), types.map(function.returnType()), parameterTypes));
        }
        for (GlobalVariable global : program.globals()) {
            module.defineGlobalVariable(global.name(), types.zeroValue(global.type()));
        }
        for (TypedFunction function : program.functions()) {
            generateFunction(function, module);
        }

        IrModule result = module.build();
        CompilerLogger.debug("Codegen: {} globals, {} functions", result.globals().size(), result.functions().size());
        return result;
    }

    private void generateFunction(TypedFunction function, ModuleContext module) {
        ModuleContext.FunctionHeader header = module.function(function.name());
        FunctionEmitter emitter = new FunctionEmitter(header.irName(), header.returnType());
        FunctionGenContext ctx = new FunctionGenContext(module, emitter, registry);

        // Formals and body statements share one frame, as they share one scope.
        ctx.pushFrame();
        for (int i = 0; i < function.parameters().size(); i++) {
            TypedFunction.Parameter parameter = function.parameters().get(i);
            IrType type = header.parameterTypes().get(i);
            IrValue.Local incoming = emitter.addParameter(type, parameter.name());
            IrValue.Local storage = emitter.alloca(type, parameter.name());
            emitter.emit(new IrInstruction.Store(incoming, storage));
            ctx.bindLocal(parameter.name(), storage);
        }
        for (Statement statement : function.body().statements()) {
            ctx.lower(statement);
        }
        ctx.popFrame();

        IrInstruction.Ret defaultReturn = header.returnType().equals(IrType.VOID)
                ? new IrInstruction.Ret(null)
                : new IrInstruction.Ret(module.types().zeroValue(function.returnType()));
        module.addFunction(emitter.finish(defaultReturn));
        CompilerLogger.trace("Codegen: generated function {}", header.irName());
    }
}
