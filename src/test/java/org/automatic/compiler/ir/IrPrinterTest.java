package org.automatic.compiler.ir;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class IrPrinterTest {

    @Test
    void emptyModuleHasOnlyTheHeader() {
        IrModule module = new IrModule("demo", List.of(), List.of(), List.of());

        assertThat(IrPrinter.print(module)).isEqualTo("; ModuleID = 'demo'\nsource_filename = \"demo\"\n");
    }

    @Test
    void printsGlobalsDeclarationsAndFunctionsInOrder() {
        IrGlobal counter = new IrGlobal("COUNT", new IrValue.ConstInt(IrType.I32, 0), false);
        IrFunctionDeclaration printf = new IrFunctionDeclaration("printf", IrType.I32, List.of(IrType.I8_PTR), true);
        IrBasicBlock entry = new IrBasicBlock("entry");
        entry.add(new IrInstruction.Ret(null));
        IrBasicBlock dead = new IrBasicBlock("unreachable");
        dead.add(new IrInstruction.Ret(null));
        IrFunction main = new IrFunction("MAIN", IrType.VOID, List.of(), List.of(entry, dead));

        String text = IrPrinter.print(new IrModule("demo", List.of(counter), List.of(printf), List.of(main)));

        assertThat(text).isEqualTo(String.join("\n",
                "; ModuleID = 'demo'",
                "source_filename = \"demo\"",
                "",
                "@COUNT = global i32 0",
                "",
                "declare i32 @printf(i8*, ...)",
                "",
                "define void @MAIN() {",
                "entry:",
                "  ret void",
                "",
                "unreachable:",
                "  ret void",
                "}",
                ""));
    }

    @Test
    void stringConstantsEscapeNonPrintableBytes() {
        IrGlobal text = new IrGlobal(".str", new IrValue.ConstString("a\"b\\\né"), true);

        assertThat(IrPrinter.global(text))
                .isEqualTo("@.str = private unnamed_addr constant [8 x i8] c\"a\\22b\\5C\\0A\\C3\\A9\\00\"");
    }

    @Test
    void doublesUseTheExactHexadecimalForm() {
        assertThat(new IrValue.ConstFloat(1.0).render()).isEqualTo("0x3FF0000000000000");
        assertThat(new IrValue.ConstFloat(-0.1).render()).isEqualTo("0xBFB999999999999A");
    }

    @Test
    void parametersAreTyped() {
        IrBasicBlock entry = new IrBasicBlock("entry");
        IrValue.Local x = new IrValue.Local(IrType.DOUBLE, "X");
        entry.add(new IrInstruction.Ret(x));
        IrFunction id = new IrFunction("ID", IrType.DOUBLE, List.of(new IrParameter(x)), List.of(entry));

        assertThat(IrPrinter.function(id)).startsWith("define double @ID(double %X) {\n");
    }

    @Test
    void matrixPointersRenderNested() {
        IrType matrix = new IrType.ArrayType(3, new IrType.ArrayType(4, IrType.I32)).pointer();

        assertThat(matrix.render()).isEqualTo("[3 x [4 x i32]]*");
        assertThat(new IrValue.Null(matrix).typed()).isEqualTo("[3 x [4 x i32]]* null");
    }
}
