package org.automatic.compiler.codegen;

import org.automatic.compiler.api.CompilerErrorCode;
import org.automatic.compiler.diagnostics.CompilerAbortException;
import org.automatic.compiler.diagnostics.DiagnosticsEngine;
import org.automatic.compiler.ir.IrType;
import org.automatic.compiler.ir.IrValue;
import org.automatic.compiler.types.Type;

/**
 * Maps source types to IR types and zero values.
 * <p>
 * INT is {@code i32}, BOOL {@code i1}, FLOAT {@code double}, STRING {@code i8*}. A matrix is a
 * nullable pointer to a row-major nested array, so {@code MATRIX<INT,3,4>} is {@code [3 x [4 x i32]]*}.
 * AUTO never reaches this class after a correct analysis; it is reported as an internal error.
 */
public final class IrTypeMapper {

    private final DiagnosticsEngine diagnostics;

    public IrTypeMapper(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * @param type A resolved source type.
     * @return The IR type of its values.
     */
    public IrType map(Type type) {
        if (type instanceof Type.Matrix matrix) {
            return matrixStorage(matrix).pointer();
        }
        switch ((Type.Primitive) type) {
            case INT: return IrType.I32;
            case BOOL: return IrType.I1;
            case FLOAT: return IrType.DOUBLE;
            case STRING: return IrType.I8_PTR;
            case VOID: return IrType.VOID;
            default: throw internal("Unresolved type " + type + " reached code generation.");
        }
    }

    /**
     * @param matrix A matrix type.
     * @return The nested array type holding the elements.
     */
    public IrType.ArrayType matrixStorage(Type.Matrix matrix) {
        IrType element = elementType(matrix.elementType());
        return new IrType.ArrayType(matrix.rows(), new IrType.ArrayType(matrix.cols(), element));
    }

    private IrType elementType(Type element) {
        if (element instanceof Type.Primitive primitive && primitive.isMatrixElement()) {
            return map(primitive);
        }
        throw internal("Unknown matrix element type " + element + ".");
    }

    /**
     * @param type A storable source type.
     * @return The value variables of this type start with.
     */
    public IrValue zeroValue(Type type) {
        IrType irType = map(type);
        if (irType instanceof IrType.PointerType) {
            return new IrValue.Null(irType);
        }
        if (irType instanceof IrType.IntType) {
            return new IrValue.ConstInt(irType, 0);
        }
        if (irType instanceof IrType.DoubleType) {
            return new IrValue.ConstFloat(0.0);
        }
        throw internal("Type " + type + " has no value.");
    }

    /**
     * Records an internal error: the typed tree violates a guarantee of the analyzer.
     * @param message The message.
     * @return The exception to throw.
     */
    public CompilerAbortException internal(String message) {
        return diagnostics.abort(CompilerErrorCode.INTERNAL_ERROR, message, "<codegen>", 0);
    }
}
