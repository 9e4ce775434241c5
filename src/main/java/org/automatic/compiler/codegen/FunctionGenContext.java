package org.automatic.compiler.codegen;

import org.automatic.compiler.frontend.semantics.tree.Statement;
import org.automatic.compiler.frontend.semantics.tree.TypedExpression;
import org.automatic.compiler.ir.IrValue;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Mutable context passed to the lowerings while one function is generated.
 * It resolves variables to their storage: local frames from innermost to outermost, then globals.
 */
public final class FunctionGenContext {

    private final ModuleContext module;
    private final FunctionEmitter emitter;
    private final StatementLoweringRegistry registry;
    private final ExpressionLowering expressions;
    private final Deque<Map<String, IrValue>> frames = new ArrayDeque<>();

    public FunctionGenContext(ModuleContext module, FunctionEmitter emitter, StatementLoweringRegistry registry) {
        this.module = module;
        this.emitter = emitter;
        this.registry = registry;
        this.expressions = new ExpressionLowering(this);
    }

    /**
     * Lowers a statement by resolving and invoking its lowering.
     * @param statement The statement.
     */
    public void lower(Statement statement) {
        registry.resolve(statement).lower(statement, this);
    }

    /**
     * Lowers an expression.
     * @param expression The expression.
     * @return Its value, or {@code null} for VOID expressions.
     */
    public IrValue lower(TypedExpression expression) {
        return expressions.lower(expression);
    }

    /** Opens a frame for the variables of a block. */
    public void pushFrame() {
        frames.push(new HashMap<>());
    }

    /** Closes the innermost frame. */
    public void popFrame() {
        frames.pop();
    }

    /**
     * Binds a variable of the innermost frame to its storage.
     * @param name The source name.
     * @param pointer The pointer to the storage.
     */
    public void bindLocal(String name, IrValue pointer) {
        frames.peek().put(name, pointer);
    }

    /**
     * @param name The source name.
     * @return The pointer to the variable's storage.
     */
    public IrValue storage(String name) {
        for (Map<String, IrValue> frame : frames) {
            IrValue pointer = frame.get(name);
            if (pointer != null) {
                return pointer;
            }
        }
        IrValue global = module.globalVariable(name);
        if (global == null) {
            throw module.types().internal("No storage for variable '" + name + "'.");
        }
        return global;
    }

    public FunctionEmitter emitter() {
        return emitter;
    }

    public ModuleContext module() {
        return module;
    }

    public IrTypeMapper types() {
        return module.types();
    }
}
