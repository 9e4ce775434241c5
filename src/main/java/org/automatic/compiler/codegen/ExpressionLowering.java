package org.automatic.compiler.codegen;

import org.automatic.compiler.frontend.parser.ast.UnaryOperator;
import org.automatic.compiler.frontend.semantics.BuiltinFunction;
import org.automatic.compiler.frontend.semantics.tree.Expression;
import org.automatic.compiler.frontend.semantics.tree.TypedExpression;
import org.automatic.compiler.ir.BinaryOpcode;
import org.automatic.compiler.ir.ComparePredicate;
import org.automatic.compiler.ir.IrFunctionDeclaration;
import org.automatic.compiler.ir.IrInstruction;
import org.automatic.compiler.ir.IrType;
import org.automatic.compiler.ir.IrValue;
import org.automatic.compiler.types.Type;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers typed expressions at the current insertion point. The IR type of every value comes from
 * the type the analyzer attached to the expression.
 */
final class ExpressionLowering {

    private static final String INT_FORMAT = "%d\n";
    private static final String FLOAT_FORMAT = "%g\n";
    private static final String STRING_FORMAT = "%s\n";

    private final FunctionGenContext ctx;

    ExpressionLowering(FunctionGenContext ctx) {
        this.ctx = ctx;
    }

    /**
     * @param typed The expression.
     * @return Its value, or {@code null} if it has type VOID.
     */
    IrValue lower(TypedExpression typed) {
        Expression e = typed.expression();
        if (e instanceof Expression.IntLit lit) {
            return new IrValue.ConstInt(IrType.I32, lit.value());
        }
        if (e instanceof Expression.FloatLit lit) {
            return new IrValue.ConstFloat(lit.value());
        }
        if (e instanceof Expression.BoolLit lit) {
            return new IrValue.ConstInt(IrType.I1, lit.value() ? 1 : 0);
        }
        if (e instanceof Expression.StrLit lit) {
            return ctx.module().stringConstant(lit.value());
        }
        if (e instanceof Expression.NoExpr) {
            return null;
        }
        if (e instanceof Expression.MatrixLit matrix) {
            return matrixLiteral(typed.type(), matrix);
        }
        if (e instanceof Expression.Id id) {
            IrValue.Local value = ctx.emitter().newLocal(ctx.types().map(typed.type()), id.name());
            ctx.emitter().emit(new IrInstruction.Load(value, ctx.storage(id.name())));
            return value;
        }
        if (e instanceof Expression.Assign assign) {
            IrValue value = requireValue(lower(assign.value()));
            ctx.emitter().emit(new IrInstruction.Store(value, ctx.storage(assign.target())));
            return value;
        }
        if (e instanceof Expression.Binary binary) {
            return binary(binary);
        }
        if (e instanceof Expression.Unary unary) {
            return unary(typed.type(), unary);
        }
        if (e instanceof Expression.Call call) {
            return call.isBuiltin() ? builtin(call) : userCall(typed.type(), call);
        }
        throw ctx.types().internal("Unknown expression " + e.getClass().getSimpleName() + ".");
    }

    private IrValue binary(Expression.Binary binary) {
        Type leftType = binary.left().type();
        BinaryOperatorTable.Form form = BinaryOperatorTable.lookup(binary.operator(), leftType)
                .orElseThrow(() -> ctx.types().internal(
                        "No lowering for '" + binary.operator().symbol() + "' on " + leftType + "."));
        IrValue left = requireValue(lower(binary.left()));
        IrValue right = requireValue(lower(binary.right()));
        FunctionEmitter emitter = ctx.emitter();
        if (form.isComparison()) {
            IrValue.Local result = emitter.newLocal(IrType.I1, "tmp");
            emitter.emit(new IrInstruction.Compare(result, form.predicate(), left, right));
            return result;
        }
        IrValue.Local result = emitter.newLocal(left.type(), "tmp");
        emitter.emit(new IrInstruction.Binary(result, form.opcode(), left, right));
        return result;
    }

    private IrValue unary(Type type, Expression.Unary unary) {
        IrValue operand = requireValue(lower(unary.operand()));
        FunctionEmitter emitter = ctx.emitter();
        IrValue.Local result = emitter.newLocal(operand.type(), "tmp");
        if (unary.operator() == UnaryOperator.NOT) {
            emitter.emit(new IrInstruction.Binary(result, BinaryOpcode.XOR, operand, new IrValue.ConstInt(IrType.I1, 1)));
        } else if (type == Type.FLOAT) {
            emitter.emit(new IrInstruction.FNeg(result, operand));
        } else {
            emitter.emit(new IrInstruction.Binary(result, BinaryOpcode.SUB, new IrValue.ConstInt(IrType.I32, 0), operand));
        }
        return result;
    }

    private IrValue matrixLiteral(Type type, Expression.MatrixLit matrix) {
        Type.Matrix matrixType = (Type.Matrix) type;
        IrType.ArrayType storage = ctx.types().matrixStorage(matrixType);
        IrType.ArrayType rowType = (IrType.ArrayType) storage.element();
        List<IrValue> rows = new ArrayList<>();
        for (List<TypedExpression> row : matrix.rows()) {
            List<IrValue> elements = new ArrayList<>();
            for (TypedExpression element : row) {
                elements.add(lower(element));
            }
            rows.add(new IrValue.ConstArray(rowType, elements));
        }
        return ctx.module().matrixConstant(new IrValue.ConstArray(storage, rows));
    }

    private IrValue userCall(Type type, Expression.Call call) {
        ModuleContext.FunctionHeader header = ctx.module().function(call.callee());
        List<IrValue> arguments = new ArrayList<>();
        for (TypedExpression argument : call.arguments()) {
            arguments.add(requireValue(lower(argument)));
        }
        IrValue.Local result = type == Type.VOID
                ? null
                : ctx.emitter().newLocal(header.returnType(), call.callee() + "_result");
        ctx.emitter().emit(new IrInstruction.Call(result, header.returnType(), header.irName(), null, arguments));
        return result;
    }

    private IrValue builtin(Expression.Call call) {
        TypedExpression argument = call.arguments().get(0);
        IrValue value = requireValue(lower(argument));
        FunctionEmitter emitter = ctx.emitter();
        BuiltinFunction builtin = call.builtin();

        if (builtin == BuiltinFunction.ROWS || builtin == BuiltinFunction.COLS) {
            Type.Matrix matrix = (Type.Matrix) argument.type();
            int dimension = builtin == BuiltinFunction.ROWS ? matrix.rows() : matrix.cols();
            IrValue.Local isNull = emitter.newLocal(IrType.I1, "isnull");
            emitter.emit(new IrInstruction.Compare(isNull, ComparePredicate.EQ, value, new IrValue.Null(value.type())));
            IrValue.Local result = emitter.newLocal(IrType.I32, call.callee() + "_result");
            emitter.emit(new IrInstruction.Select(result, isNull,
                    new IrValue.ConstInt(IrType.I32, 0), new IrValue.ConstInt(IrType.I32, dimension)));
            return result;
        }

        String format;
        if (argument.type() == Type.STRING) {
            format = STRING_FORMAT;
        } else if (argument.type() == Type.FLOAT) {
            format = FLOAT_FORMAT;
        } else {
            format = INT_FORMAT;
            if (argument.type() == Type.BOOL) {
                IrValue.Local widened = emitter.newLocal(IrType.I32, "tmp");
                emitter.emit(new IrInstruction.ZExt(widened, value));
                value = widened;
            }
        }
        IrFunctionDeclaration printf = ctx.module().printf();
        emitter.emit(new IrInstruction.Call(null, printf.returnType(), printf.name(), printf.signature(),
                List.of(ctx.module().stringConstant(format), value)));
        return null;
    }

    private IrValue requireValue(IrValue value) {
        if (value == null) {
            throw ctx.types().internal("A VOID expression is used as a value.");
        }
        return value;
    }
}
