package org.automatic.compiler.frontend.semantics;

import org.automatic.compiler.api.CompilerErrorCode;
import org.automatic.compiler.diagnostics.CompilerAbortException;
import org.automatic.compiler.diagnostics.CompilerLogger;
import org.automatic.compiler.diagnostics.DiagnosticsEngine;
import org.automatic.compiler.frontend.lexer.Token;
import org.automatic.compiler.frontend.parser.ast.BlockNode;
import org.automatic.compiler.frontend.parser.ast.ExpressionNode;
import org.automatic.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.automatic.compiler.frontend.parser.ast.ForNode;
import org.automatic.compiler.frontend.parser.ast.FunctionNode;
import org.automatic.compiler.frontend.parser.ast.GlobalVariableNode;
import org.automatic.compiler.frontend.parser.ast.IfNode;
import org.automatic.compiler.frontend.parser.ast.ParameterNode;
import org.automatic.compiler.frontend.parser.ast.ProgramNode;
import org.automatic.compiler.frontend.parser.ast.ReturnNode;
import org.automatic.compiler.frontend.parser.ast.StatementNode;
import org.automatic.compiler.frontend.parser.ast.TypeNode;
import org.automatic.compiler.frontend.parser.ast.VarDeclNode;
import org.automatic.compiler.frontend.parser.ast.WhileNode;
import org.automatic.compiler.frontend.semantics.analysis.BlockAnalysisHandler;
import org.automatic.compiler.frontend.semantics.analysis.ExpressionStatementAnalysisHandler;
import org.automatic.compiler.frontend.semantics.analysis.ForAnalysisHandler;
import org.automatic.compiler.frontend.semantics.analysis.IAnalysisHandler;
import org.automatic.compiler.frontend.semantics.analysis.IfAnalysisHandler;
import org.automatic.compiler.frontend.semantics.analysis.ReturnAnalysisHandler;
import org.automatic.compiler.frontend.semantics.analysis.VarDeclAnalysisHandler;
import org.automatic.compiler.frontend.semantics.analysis.WhileAnalysisHandler;
import org.automatic.compiler.frontend.semantics.tree.GlobalVariable;
import org.automatic.compiler.frontend.semantics.tree.Statement;
import org.automatic.compiler.frontend.semantics.tree.TypedExpression;
import org.automatic.compiler.frontend.semantics.tree.TypedFunction;
import org.automatic.compiler.frontend.semantics.tree.TypedProgram;
import org.automatic.compiler.types.Type;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Performs semantic analysis on the AST: scope resolution, type inference for AUTO and type
 * checking. It produces the typed tree that code generation consumes, or aborts on the first error.
 * <p>
 * Top-level declarations are collected in a first pass, so functions may call functions declared
 * later. Statements are then dispatched to one {@link IAnalysisHandler} per node class;
 * expressions are checked by the {@link ExpressionTypeChecker}.
 */
public class SemanticAnalyzer {

    private final DiagnosticsEngine diagnostics;
    private final SymbolTable symbolTable;
    private final ExpressionTypeChecker expressions;
    private final Map<Class<? extends StatementNode>, IAnalysisHandler> handlers = new HashMap<>();
    private Type currentReturnType;

    /**
     * Constructs a new semantic analyzer.
     * @param diagnostics The diagnostics engine for reporting errors.
     * @param symbolTable The symbol table to fill.
     */
    public SemanticAnalyzer(DiagnosticsEngine diagnostics, SymbolTable symbolTable) {
        this.diagnostics = diagnostics;
        this.symbolTable = symbolTable;
        this.expressions = new ExpressionTypeChecker(this);
        registerDefaultHandlers();
    }

    private void registerDefaultHandlers() {
        handlers.put(BlockNode.class, new BlockAnalysisHandler());
        handlers.put(VarDeclNode.class, new VarDeclAnalysisHandler());
        handlers.put(ExpressionStatementNode.class, new ExpressionStatementAnalysisHandler());
        handlers.put(ReturnNode.class, new ReturnAnalysisHandler());
        handlers.put(IfNode.class, new IfAnalysisHandler());
        handlers.put(WhileNode.class, new WhileAnalysisHandler());
        handlers.put(ForNode.class, new ForAnalysisHandler());
    }

    /**
     * Analyzes a whole program.
     * @param program The parsed program.
     * @return The typed program.
     * @throws CompilerAbortException on the first semantic error.
     */
    public TypedProgram analyze(ProgramNode program) {
        List<GlobalVariable> globals = new ArrayList<>();
        for (GlobalVariableNode global : program.globals()) {
            Type type = checkStorageType(global.type(), "Global variable");
            if (!symbolTable.declare(SymbolTable.GLOBAL_SCOPE, global.name().text(), type)) {
                throw error(CompilerErrorCode.DUPLICATE_DECLARATION,
                        "Variable '" + global.name().text() + "' is already declared.", global.name());
            }
            globals.add(new GlobalVariable(type, global.name().text()));
        }
        for (FunctionNode function : program.functions()) {
            registerFunction(function);
        }

        List<TypedFunction> functions = new ArrayList<>();
        for (FunctionNode function : program.functions()) {
            functions.add(analyzeFunction(function));
        }
        CompilerLogger.debug("Semantics: {} globals, {} functions, {} scopes",
                globals.size(), functions.size(), symbolTable.scopeCount());
        return new TypedProgram(globals, functions);
    }

    private void registerFunction(FunctionNode function) {
        String name = function.name().text();
        if (BuiltinFunction.byName(name).isPresent()) {
            throw error(CompilerErrorCode.DUPLICATE_DECLARATION,
                    "Function '" + name + "' clashes with a built-in.", function.name());
        }
        Type returnType = function.returnType().type();
        if (returnType == Type.AUTO) {
            throw error(CompilerErrorCode.INVALID_DECLARATION_TYPE,
                    "AUTO is not allowed as return type of '" + name + "'.", function.returnType().token());
        }
        checkMatrixElement(function.returnType());
        List<Type> parameterTypes = new ArrayList<>();
        for (ParameterNode parameter : function.parameters()) {
            parameterTypes.add(checkStorageType(parameter.type(), "Parameter"));
        }
        if (!symbolTable.defineFunction(new FunctionSignature(name, returnType, parameterTypes))) {
            throw error(CompilerErrorCode.DUPLICATE_DECLARATION,
                    "Function '" + name + "' is already declared.", function.name());
        }
    }

    private TypedFunction analyzeFunction(FunctionNode function) {
        int scope = symbolTable.createScope(SymbolTable.GLOBAL_SCOPE);
        FunctionSignature signature = symbolTable.resolveFunction(function.name().text()).orElseThrow();

        List<TypedFunction.Parameter> parameters = new ArrayList<>();
        for (int i = 0; i < function.parameters().size(); i++) {
            Token name = function.parameters().get(i).name();
            Type type = signature.parameterTypes().get(i);
            if (!symbolTable.declare(scope, name.text(), type)) {
                throw error(CompilerErrorCode.DUPLICATE_DECLARATION,
                        "Parameter '" + name.text() + "' is declared twice.", name);
            }
            parameters.add(new TypedFunction.Parameter(type, name.text()));
        }

        currentReturnType = signature.returnType();
        List<Statement> body = new ArrayList<>();
        for (StatementNode statement : function.body()) {
            body.add(analyzeStatement(statement, scope));
        }
        currentReturnType = null;
        return new TypedFunction(signature.name(), parameters, signature.returnType(), new Statement.Block(body, scope));
    }

    /**
     * Analyzes one statement in the given scope.
     * @param node The statement.
     * @param scopeId The enclosing scope.
     * @return The typed statement.
     */
    public Statement analyzeStatement(StatementNode node, int scopeId) {
        IAnalysisHandler handler = handlers.get(node.getClass());
        if (handler == null) {
            throw diagnostics.abort(CompilerErrorCode.INTERNAL_ERROR,
                    "No analysis handler for " + node.getClass().getSimpleName() + ".", "<internal>", 0);
        }
        return handler.analyze(node, scopeId, this);
    }

    /**
     * Analyzes the body of a control statement in a scope of its own, so that a declaration used
     * as an unbraced body never leaks into the enclosing scope.
     * @param node The body.
     * @param parentScopeId The enclosing scope.
     * @return The typed body as a block.
     */
    public Statement analyzeNested(StatementNode node, int parentScopeId) {
        if (node instanceof BlockNode) {
            return analyzeStatement(node, parentScopeId);
        }
        int scope = symbolTable.createScope(parentScopeId);
        return new Statement.Block(List.of(analyzeStatement(node, scope)), scope);
    }

    /**
     * Analyzes an expression.
     * @param node The expression.
     * @param scopeId The scope of the expression.
     * @return The typed expression.
     */
    public TypedExpression analyzeExpression(ExpressionNode node, int scopeId) {
        return expressions.check(node, scopeId);
    }

    /**
     * Analyzes the condition of IF, WHILE or FOR, which must be BOOL.
     * @param node The condition.
     * @param scopeId The scope of the condition.
     * @param construct The statement keyword, for the error message.
     * @return The typed condition.
     */
    public TypedExpression analyzeCondition(ExpressionNode node, int scopeId, String construct) {
        TypedExpression condition = analyzeExpression(node, scopeId);
        if (condition.type() != Type.BOOL) {
            throw error(CompilerErrorCode.TYPE_MISMATCH,
                    construct + " condition must be BOOL but is " + condition.type() + ".", node.anchor());
        }
        return condition;
    }

    /**
     * Checks that a value has exactly the declared type.
     * @param expected The declared type.
     * @param value The value.
     * @param at The token to report at.
     * @param message The error message.
     */
    public void checkAssignable(Type expected, TypedExpression value, Token at, String message) {
        expressions.requireAssignable(expected, value, at, message);
    }

    /**
     * Checks a type that a variable or parameter is declared with: not VOID, not AUTO, and
     * matrices only of INT, BOOL or FLOAT.
     * @param typeNode The declared type.
     * @param role What is being declared, for the error message.
     * @return The type.
     */
    public Type checkStorageType(TypeNode typeNode, String role) {
        if (!typeNode.type().isStorable()) {
            throw error(CompilerErrorCode.INVALID_DECLARATION_TYPE,
                    role + " cannot have type " + typeNode.type() + ".", typeNode.token());
        }
        checkMatrixElement(typeNode);
        return typeNode.type();
    }

    /**
     * Rejects matrix types whose element type cannot be stored in a matrix.
     * @param typeNode The declared type.
     */
    public void checkMatrixElement(TypeNode typeNode) {
        if (typeNode.type() instanceof Type.Matrix matrix
                && !(matrix.elementType() instanceof Type.Primitive element && element.isMatrixElement())) {
            throw error(CompilerErrorCode.INVALID_DECLARATION_TYPE,
                    "Matrix elements must be INT, BOOL or FLOAT, not " + matrix.elementType() + ".", typeNode.token());
        }
    }

    /**
     * Declares a local variable.
     * @param scopeId The scope.
     * @param name The name token.
     * @param type The resolved type.
     */
    public void declareVariable(int scopeId, Token name, Type type) {
        if (!symbolTable.declare(scopeId, name.text(), type)) {
            throw error(CompilerErrorCode.DUPLICATE_DECLARATION,
                    "Variable '" + name.text() + "' is already declared in this scope.", name);
        }
    }

    /**
     * Records a semantic error.
     * @param code The error code.
     * @param message The message.
     * @param at The token the error refers to.
     * @return The exception to throw.
     */
    public CompilerAbortException error(CompilerErrorCode code, String message, Token at) {
        return diagnostics.abort(code, message, at.fileName(), at.line());
    }

    /**
     * @return The return type of the function being analyzed.
     */
    public Type currentReturnType() {
        return currentReturnType;
    }

    /**
     * @return The symbol table.
     */
    public SymbolTable getSymbolTable() {
        return symbolTable;
    }
}
