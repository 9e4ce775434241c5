package org.automatic.compiler.codegen;

import org.automatic.compiler.api.CompilerErrorCode;
import org.automatic.compiler.diagnostics.CompilerAbortException;
import org.automatic.compiler.diagnostics.DiagnosticsEngine;
import org.automatic.compiler.frontend.lexer.Lexer;
import org.automatic.compiler.frontend.parser.Parser;
import org.automatic.compiler.frontend.semantics.SemanticAnalyzer;
import org.automatic.compiler.frontend.semantics.SymbolTable;
import org.automatic.compiler.frontend.semantics.tree.GlobalVariable;
import org.automatic.compiler.frontend.semantics.tree.TypedProgram;
import org.automatic.compiler.ir.IrBasicBlock;
import org.automatic.compiler.ir.IrFunction;
import org.automatic.compiler.ir.IrInstruction;
import org.automatic.compiler.ir.IrModule;
import org.automatic.compiler.ir.IrPrinter;
import org.automatic.compiler.types.Type;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the {@link CodeGenerator}: storage, type-directed lowering and the block
 * shapes of IF, WHILE and FOR.
 */
@Tag("unit")
class CodeGeneratorTest {

    private DiagnosticsEngine diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
    }

    private IrModule generate(String source) {
        Parser parser = new Parser(new Lexer(source, diagnostics, "test.mat").scanTokens(), diagnostics);
        TypedProgram program = new SemanticAnalyzer(diagnostics, new SymbolTable()).analyze(parser.parse());
        return new CodeGenerator(diagnostics).generate(program, "test");
    }

    private static List<String> lines(IrBasicBlock block) {
        return block.instructions().stream().map(IrInstruction::render).collect(Collectors.toList());
    }

    private static List<String> labels(IrFunction function) {
        return function.blocks().stream().map(IrBasicBlock::label).collect(Collectors.toList());
    }

    private static String last(IrBasicBlock block) {
        List<String> rendered = lines(block);
        return rendered.get(rendered.size() - 1);
    }

    @Test
    void generatesFunctionWithFormalsCopiedToStorage() {
        IrModule module = generate("INT ADD(INT A, INT B) { RETURN A + B; }");

        assertThat(IrPrinter.print(module)).isEqualTo(String.join("\n",
                "; ModuleID = 'test'",
                "source_filename = \"test\"",
                "",
                "define i32 @ADD(i32 %A, i32 %B) {",
                "entry:",
                "  %A1 = alloca i32",
                "  %B1 = alloca i32",
                "  store i32 %A, i32* %A1",
                "  store i32 %B, i32* %B1",
                "  %A2 = load i32, i32* %A1",
                "  %B2 = load i32, i32* %B1",
                "  %tmp = add i32 %A2, %B2",
                "  ret i32 %tmp",
                "}",
                ""));
    }

    @Test
    void globalsAreZeroInitialised() {
        IrModule module = generate("INT G;\nFLOAT F;\nBOOL B;\nSTRING S;\nMATRIX<INT, 2, 2> M;");

        assertThat(IrPrinter.print(module)).contains(
                "@G = global i32 0\n",
                "@F = global double 0x0000000000000000\n",
                "@B = global i1 false\n",
                "@S = global i8* null\n",
                "@M = global [2 x [2 x i32]]* null\n");
    }

    @Test
    void functionNamesAreReservedBeforeGlobals() {
        IrModule module = generate("INT G;\nINT G() { RETURN G; }");
        String ir = IrPrinter.print(module);

        assertThat(ir).contains("define i32 @G()", "@G1 = global i32 0", "load i32, i32* @G1");
    }

    @Test
    void localsWithoutInitializerStoreZero() {
        IrFunction main = generate("VOID MAIN() { FLOAT X; MATRIX<BOOL, 1, 1> M; }").function("MAIN");

        assertThat(lines(main.blocks().get(0))).containsExactly(
                "%X = alloca double",
                "%M = alloca [1 x [1 x i1]]*",
                "store double 0x0000000000000000, double* %X",
                "store [1 x [1 x i1]]* null, [1 x [1 x i1]]** %M",
                "ret void");
    }

    @Test
    void allocasAreHoistedIntoEntryBlock() {
        IrFunction main = generate("VOID MAIN() { IF (TRUE) { INT X = 1; } }").function("MAIN");

        IrBasicBlock entry = main.blocks().get(0);
        assertThat(entry.instructions().get(0)).isInstanceOf(IrInstruction.Alloca.class);
        assertThat(main.blocks().stream().skip(1).flatMap(b -> b.instructions().stream()))
                .noneMatch(i -> i instanceof IrInstruction.Alloca);
    }

    @Test
    void ifLowersIntoThenElseAndMerge() {
        IrFunction main = generate("VOID MAIN() { INT X; IF (X < 1) X = 1; ELSE X = 2; }").function("MAIN");

        assertThat(labels(main)).containsExactly("entry", "then", "else", "merge");
        assertThat(last(main.blocks().get(0))).isEqualTo("br i1 %tmp, label %then, label %else");
        assertThat(last(main.blocks().get(1))).isEqualTo("br label %merge");
        assertThat(last(main.blocks().get(2))).isEqualTo("br label %merge");
        assertThat(last(main.blocks().get(3))).isEqualTo("ret void");
    }

    @Test
    void branchIntoMergeOnlyFromOpenBlocks() {
        IrFunction f = generate("INT F(BOOL C) { IF (C) RETURN 1; ELSE RETURN 2; }").function("F");

        assertThat(labels(f)).containsExactly("entry", "then", "else", "merge");
        assertThat(lines(f.blocks().get(1))).containsExactly("ret i32 1");
        assertThat(lines(f.blocks().get(2))).containsExactly("ret i32 2");
        assertThat(lines(f.blocks().get(3))).containsExactly("ret i32 0");
    }

    @Test
    void whileTestsBeforeTheBody() {
        IrFunction main = generate("VOID MAIN() { INT I; WHILE (I < 3) I = I + 1; }").function("MAIN");

        assertThat(labels(main)).containsExactly("entry", "while", "while_body", "merge");
        assertThat(last(main.blocks().get(0))).isEqualTo("br label %while");
        assertThat(last(main.blocks().get(1))).isEqualTo("br i1 %tmp, label %while_body, label %merge");
        assertThat(last(main.blocks().get(2))).isEqualTo("br label %while");
    }

    @Test
    void forLowersExactlyLikeTheEquivalentWhile() {
        String viaFor = IrPrinter.print(generate(
                "VOID MAIN() { INT I; FOR (I = 0; I < 3; I = I + 1) PRINT(I); }"));
        String viaWhile = IrPrinter.print(generate(
                "VOID MAIN() { INT I; I = 0; WHILE (I < 3) { PRINT(I); I = I + 1; } }"));

        assertThat(viaFor).isEqualTo(viaWhile);
    }

    @Test
    void forWithoutConditionLoopsOnTrue() {
        IrFunction main = generate("VOID MAIN() { FOR (;;) RETURN; }").function("MAIN");

        assertThat(last(main.blocks().get(1))).isEqualTo("br i1 true, label %while_body, label %merge");
    }

    @Test
    void statementsAfterReturnGoToAnUnreachableBlock() {
        IrFunction f = generate("INT F() { RETURN 1; PRINT(2); RETURN 3; }").function("F");

        assertThat(labels(f)).containsExactly("entry", "unreachable");
        for (IrBasicBlock block : f.blocks()) {
            assertThat(block.instructions()).filteredOn(IrInstruction::isTerminator).hasSize(1);
            assertThat(block.instructions().get(block.instructions().size() - 1).isTerminator()).isTrue();
        }
    }

    @Test
    void fallingOffTheEndReturnsZero() {
        IrModule module = generate("INT I() { }\nFLOAT F() { }\nBOOL B() { }\nVOID V() { }");

        assertThat(last(module.function("I").blocks().get(0))).isEqualTo("ret i32 0");
        assertThat(last(module.function("F").blocks().get(0))).isEqualTo("ret double 0x0000000000000000");
        assertThat(last(module.function("B").blocks().get(0))).isEqualTo("ret i1 false");
        assertThat(last(module.function("V").blocks().get(0))).isEqualTo("ret void");
    }

    @Test
    void floatOperatorsUseFloatingForms() {
        IrFunction f = generate("BOOL F(FLOAT A) { RETURN -A * 2.0 < A / 0.5; }").function("F");
        String body = String.join("\n", lines(f.blocks().get(0)));

        assertThat(body).contains("fneg double", "fmul double", "fdiv double", "fcmp olt double");
        assertThat(body).contains("0x4000000000000000");
    }

    @Test
    void integerAndLogicalOperators() {
        IrFunction f = generate("BOOL F(INT A, BOOL B) { RETURN -A / 2 >= A && !B || B; }").function("F");
        String body = String.join("\n", lines(f.blocks().get(0)));

        assertThat(body).contains("sub i32 0, %A2", "sdiv i32", "icmp sge i32", "xor i1 %B2, true", "and i1", "or i1");
    }

    @Test
    void callResultsAreNamedAfterTheCallee() {
        IrFunction main = generate(
                "INT TWICE(INT X) { RETURN X * 2; }\nVOID NOTHING() { }\nVOID MAIN() { INT Y = TWICE(2); TWICE(Y); NOTHING(); }")
                .function("MAIN");

        assertThat(lines(main.blocks().get(0))).contains(
                "%TWICE_result = call i32 @TWICE(i32 2)",
                "%TWICE_result1 = call i32 @TWICE(i32 %Y1)",
                "call void @NOTHING()");
    }

    @Test
    void rowsAndColsComeFromTheStaticTypeAndGuardNull() {
        IrFunction main = generate(
                "VOID MAIN() { MATRIX<INT, 3, 4> M; PRINT(ROWS(M)); PRINT(COLS(M)); }").function("MAIN");

        assertThat(lines(main.blocks().get(0))).contains(
                "%isnull = icmp eq [3 x [4 x i32]]* %M1, null",
                "%ROWS_result = select i1 %isnull, i32 0, i32 3",
                "%isnull1 = icmp eq [3 x [4 x i32]]* %M2, null",
                "%COLS_result = select i1 %isnull1, i32 0, i32 4");
    }

    @Test
    void printChoosesFormatByArgumentType() {
        IrModule module = generate(
                "VOID MAIN() { PRINT(1); PRINT(TRUE); PRINT(2.5); PRINTSTR(\"hi\"); }");
        String ir = IrPrinter.print(module);

        assertThat(ir).contains(
                "@.str = private unnamed_addr constant [4 x i8] c\"%d\\0A\\00\"",
                "@.str1 = private unnamed_addr constant [4 x i8] c\"%g\\0A\\00\"",
                "@.str2 = private unnamed_addr constant [3 x i8] c\"hi\\00\"",
                "@.str3 = private unnamed_addr constant [4 x i8] c\"%s\\0A\\00\"",
                "declare i32 @printf(i8*, ...)",
                "%tmp = zext i1 true to i32",
                "call i32 (i8*, ...) @printf(i8* getelementptr inbounds ([4 x i8], [4 x i8]* @.str, i32 0, i32 0), i32 1)",
                "i32 %tmp)",
                "double 0x4004000000000000)");
        assertThat(module.declarations()).hasSize(1);
    }

    @Test
    void matrixLiteralBecomesConstantGlobal() {
        IrModule module = generate("VOID MAIN() { AUTO M = [[1, -2], [3, 4]]; }");

        assertThat(IrPrinter.print(module)).contains(
                "@.matrix = private unnamed_addr constant [2 x [2 x i32]] "
                        + "[[2 x i32] [i32 1, i32 -2], [2 x i32] [i32 3, i32 4]]",
                "store [2 x [2 x i32]]* @.matrix, [2 x [2 x i32]]** %M");
    }

    @Test
    void generationIsDeterministic() {
        String source = "INT G;\nINT F(INT X) { WHILE (X > 0) X = X - 1; RETURN X; }\nVOID MAIN() { G = F(3); PRINT(G); }";

        String first = IrPrinter.print(generate(source));
        diagnostics = new DiagnosticsEngine();
        String second = IrPrinter.print(generate(source));

        assertThat(first).isEqualTo(second);
    }

    @Test
    void unresolvedTypeIsAnInternalError() {
        TypedProgram program = new TypedProgram(List.of(new GlobalVariable(Type.AUTO, "X")), List.of());

        assertThatThrownBy(() -> new CodeGenerator(diagnostics).generate(program, "test"))
                .isInstanceOf(CompilerAbortException.class)
                .satisfies(e -> assertThat(((CompilerAbortException) e).diagnostic().code())
                        .isEqualTo(CompilerErrorCode.INTERNAL_ERROR));
    }
}
