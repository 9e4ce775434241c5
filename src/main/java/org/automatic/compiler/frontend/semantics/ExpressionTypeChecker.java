package org.automatic.compiler.frontend.semantics;

import org.automatic.compiler.api.CompilerErrorCode;
import org.automatic.compiler.frontend.lexer.Token;
import org.automatic.compiler.frontend.parser.ast.AssignNode;
import org.automatic.compiler.frontend.parser.ast.BinaryOpNode;
import org.automatic.compiler.frontend.parser.ast.BinaryOperator;
import org.automatic.compiler.frontend.parser.ast.BoolLiteralNode;
import org.automatic.compiler.frontend.parser.ast.CallNode;
import org.automatic.compiler.frontend.parser.ast.ExpressionNode;
import org.automatic.compiler.frontend.parser.ast.FloatLiteralNode;
import org.automatic.compiler.frontend.parser.ast.IdentifierNode;
import org.automatic.compiler.frontend.parser.ast.IntegerLiteralNode;
import org.automatic.compiler.frontend.parser.ast.MatrixLiteralNode;
import org.automatic.compiler.frontend.parser.ast.NoExprNode;
import org.automatic.compiler.frontend.parser.ast.StringLiteralNode;
import org.automatic.compiler.frontend.parser.ast.UnaryOpNode;
import org.automatic.compiler.frontend.parser.ast.UnaryOperator;
import org.automatic.compiler.frontend.semantics.tree.Expression;
import org.automatic.compiler.frontend.semantics.tree.TypedExpression;
import org.automatic.compiler.types.Type;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves identifiers and computes the type of every expression.
 */
public class ExpressionTypeChecker {

    private final SemanticAnalyzer analyzer;

    /**
     * @param analyzer The analyzer that owns the symbol table and diagnostics.
     */
    public ExpressionTypeChecker(SemanticAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    /**
     * Checks an expression.
     * @param node The expression.
     * @param scopeId The scope the expression appears in.
     * @return The typed expression.
     */
    public TypedExpression check(ExpressionNode node, int scopeId) {
        if (node instanceof IntegerLiteralNode lit) {
            return new TypedExpression(Type.INT, new Expression.IntLit(lit.value()));
        }
        if (node instanceof FloatLiteralNode lit) {
            return new TypedExpression(Type.FLOAT, new Expression.FloatLit(lit.value()));
        }
        if (node instanceof BoolLiteralNode lit) {
            return new TypedExpression(Type.BOOL, new Expression.BoolLit(lit.value()));
        }
        if (node instanceof StringLiteralNode lit) {
            return new TypedExpression(Type.STRING, new Expression.StrLit(lit.value()));
        }
        if (node instanceof NoExprNode) {
            return new TypedExpression(Type.VOID, new Expression.NoExpr());
        }
        if (node instanceof IdentifierNode id) {
            Type type = resolveVariable(id.identifierToken(), scopeId);
            return new TypedExpression(type, new Expression.Id(id.name()));
        }
        if (node instanceof AssignNode assign) {
            return checkAssign(assign, scopeId);
        }
        if (node instanceof BinaryOpNode binary) {
            return checkBinary(binary, scopeId);
        }
        if (node instanceof UnaryOpNode unary) {
            return checkUnary(unary, scopeId);
        }
        if (node instanceof CallNode call) {
            return checkCall(call, scopeId);
        }
        if (node instanceof MatrixLiteralNode matrix) {
            return checkMatrixLiteral(matrix);
        }
        throw analyzer.error(CompilerErrorCode.INTERNAL_ERROR,
                "Unknown expression " + node.getClass().getSimpleName() + ".", node.anchor());
    }

    private Type resolveVariable(Token name, int scopeId) {
        return analyzer.getSymbolTable().lookup(scopeId, name.text())
                .orElseThrow(() -> analyzer.error(CompilerErrorCode.UNDECLARED_IDENTIFIER,
                        "Undeclared identifier '" + name.text() + "'.", name));
    }

    private TypedExpression checkAssign(AssignNode assign, int scopeId) {
        Type target = resolveVariable(assign.target(), scopeId);
        TypedExpression value = check(assign.value(), scopeId);
        requireSameType(target, value.type(), assign.target(), "Cannot assign " + value.type() + " to '"
                + assign.target().text() + "' of type " + target + ".");
        return new TypedExpression(target, new Expression.Assign(assign.target().text(), value));
    }

    private TypedExpression checkBinary(BinaryOpNode binary, int scopeId) {
        TypedExpression left = check(binary.left(), scopeId);
        TypedExpression right = check(binary.right(), scopeId);
        BinaryOperator op = binary.operator();

        boolean valid;
        Type result;
        if (op.isLogical()) {
            valid = left.type() == Type.BOOL && right.type() == Type.BOOL;
            result = Type.BOOL;
        } else {
            valid = left.type().isNumeric() && left.type().equals(right.type());
            result = op.isComparison() ? Type.BOOL : left.type();
        }
        if (!valid) {
            throw analyzer.error(CompilerErrorCode.INVALID_OPERAND_TYPES,
                    "Operator '" + op.symbol() + "' cannot be applied to " + left.type() + " and " + right.type() + ".",
                    binary.operatorToken());
        }
        return new TypedExpression(result, new Expression.Binary(op, left, right));
    }

    private TypedExpression checkUnary(UnaryOpNode unary, int scopeId) {
        TypedExpression operand = check(unary.operand(), scopeId);
        boolean valid = unary.operator() == UnaryOperator.NEG
                ? operand.type().isNumeric()
                : operand.type() == Type.BOOL;
        if (!valid) {
            throw analyzer.error(CompilerErrorCode.INVALID_OPERAND_TYPES,
                    "Operator '" + unary.operatorToken().text() + "' cannot be applied to " + operand.type() + ".",
                    unary.operatorToken());
        }
        return new TypedExpression(operand.type(), new Expression.Unary(unary.operator(), operand));
    }

    private TypedExpression checkCall(CallNode call, int scopeId) {
        String name = call.callee().text();
        List<TypedExpression> arguments = new ArrayList<>();
        for (ExpressionNode argument : call.arguments()) {
            arguments.add(check(argument, scopeId));
        }

        BuiltinFunction builtin = BuiltinFunction.byName(name).orElse(null);
        if (builtin != null) {
            return checkBuiltinCall(call, builtin, arguments);
        }

        FunctionSignature signature = analyzer.getSymbolTable().resolveFunction(name)
                .orElseThrow(() -> analyzer.error(CompilerErrorCode.UNDECLARED_FUNCTION,
                        "Undeclared function '" + name + "'.", call.callee()));
        requireArity(call, signature.parameterTypes().size(), arguments.size());
        for (int i = 0; i < arguments.size(); i++) {
            Type expected = signature.parameterTypes().get(i);
            Type actual = arguments.get(i).type();
            requireSameType(expected, actual, call.arguments().get(i).anchor(),
                    "Argument " + (i + 1) + " of '" + name + "' must be " + expected + " but is " + actual + ".");
        }
        return new TypedExpression(signature.returnType(), new Expression.Call(name, null, arguments));
    }

    private TypedExpression checkBuiltinCall(CallNode call, BuiltinFunction builtin, List<TypedExpression> arguments) {
        requireArity(call, 1, arguments.size());
        Type argument = arguments.get(0).type();
        boolean accepted = switch (builtin) {
            case PRINT -> argument == Type.INT || argument == Type.BOOL || argument == Type.FLOAT;
            case PRINTSTR -> argument == Type.STRING;
            case ROWS, COLS -> argument instanceof Type.Matrix;
        };
        if (!accepted) {
            throw analyzer.error(CompilerErrorCode.TYPE_MISMATCH,
                    "Built-in '" + builtin + "' cannot take an argument of type " + argument + ".",
                    call.arguments().get(0).anchor());
        }
        Type result = (builtin == BuiltinFunction.ROWS || builtin == BuiltinFunction.COLS) ? Type.INT : Type.VOID;
        return new TypedExpression(result, new Expression.Call(builtin.name(), builtin, arguments));
    }

    private void requireArity(CallNode call, int expected, int actual) {
        if (expected != actual) {
            throw analyzer.error(CompilerErrorCode.ARITY_MISMATCH,
                    "'" + call.callee().text() + "' expects " + expected + " argument(s) but got " + actual + ".",
                    call.callee());
        }
    }

    private TypedExpression checkMatrixLiteral(MatrixLiteralNode matrix) {
        int cols = matrix.rows().get(0).size();
        Type elementType = null;
        List<List<TypedExpression>> rows = new ArrayList<>();
        for (List<ExpressionNode> row : matrix.rows()) {
            if (row.size() != cols) {
                throw analyzer.error(CompilerErrorCode.MATRIX_SHAPE_MISMATCH,
                        "Matrix rows must all have " + cols + " elements.", matrix.openBracket());
            }
            List<TypedExpression> typedRow = new ArrayList<>();
            for (ExpressionNode element : row) {
                TypedExpression constant = constantElement(element);
                if (elementType == null) {
                    elementType = constant.type();
                } else if (!elementType.equals(constant.type())) {
                    throw analyzer.error(CompilerErrorCode.TYPE_MISMATCH,
                            "Matrix elements must all be " + elementType + ", found " + constant.type() + ".",
                            element.anchor());
                }
                typedRow.add(constant);
            }
            rows.add(typedRow);
        }
        Type type = new Type.Matrix(elementType, rows.size(), cols);
        return new TypedExpression(type, new Expression.MatrixLit(rows));
    }

    /**
     * Matrix elements are literals of INT, FLOAT or BOOL, numeric ones optionally negated.
     * The negation is folded into the literal.
     */
    private TypedExpression constantElement(ExpressionNode element) {
        if (element instanceof IntegerLiteralNode lit) {
            return new TypedExpression(Type.INT, new Expression.IntLit(lit.value()));
        }
        if (element instanceof FloatLiteralNode lit) {
            return new TypedExpression(Type.FLOAT, new Expression.FloatLit(lit.value()));
        }
        if (element instanceof BoolLiteralNode lit) {
            return new TypedExpression(Type.BOOL, new Expression.BoolLit(lit.value()));
        }
        if (element instanceof UnaryOpNode unary && unary.operator() == UnaryOperator.NEG) {
            if (unary.operand() instanceof IntegerLiteralNode lit) {
                return new TypedExpression(Type.INT, new Expression.IntLit(-lit.value()));
            }
            if (unary.operand() instanceof FloatLiteralNode lit) {
                return new TypedExpression(Type.FLOAT, new Expression.FloatLit(-lit.value()));
            }
        }
        throw analyzer.error(CompilerErrorCode.TYPE_MISMATCH,
                "Matrix elements must be INT, FLOAT or BOOL literals.", element.anchor());
    }

    private void requireSameType(Type expected, Type actual, Token at, String message) {
        if (expected.equals(actual)) {
            return;
        }
        CompilerErrorCode code = expected instanceof Type.Matrix && actual instanceof Type.Matrix
                ? CompilerErrorCode.MATRIX_SHAPE_MISMATCH
                : CompilerErrorCode.TYPE_MISMATCH;
        throw analyzer.error(code, message, at);
    }

    /**
     * Checks that a value may initialise or be returned as the given type.
     * @param expected The declared type.
     * @param actual The value.
     * @param at The token to report at.
     * @param message The error message.
     */
    public void requireAssignable(Type expected, TypedExpression actual, Token at, String message) {
        requireSameType(expected, actual.type(), at, message);
    }
}
