package org.automatic.compiler.frontend.semantics;

import org.automatic.compiler.api.CompilerErrorCode;
import org.automatic.compiler.diagnostics.CompilerAbortException;
import org.automatic.compiler.diagnostics.DiagnosticsEngine;
import org.automatic.compiler.frontend.lexer.Lexer;
import org.automatic.compiler.frontend.parser.Parser;
import org.automatic.compiler.frontend.semantics.tree.Expression;
import org.automatic.compiler.frontend.semantics.tree.Statement;
import org.automatic.compiler.frontend.semantics.tree.TypedExpression;
import org.automatic.compiler.frontend.semantics.tree.TypedFunction;
import org.automatic.compiler.frontend.semantics.tree.TypedProgram;
import org.automatic.compiler.types.Type;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the {@link SemanticAnalyzer}: scoping, AUTO inference and the type rules.
 */
@Tag("unit")
class SemanticAnalyzerTest {

    private DiagnosticsEngine diagnostics;
    private SymbolTable symbolTable;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
    }

    private TypedProgram analyze(String source) {
        symbolTable = new SymbolTable();
        Parser parser = new Parser(new Lexer(source, diagnostics, "test.mat").scanTokens(), diagnostics);
        return new SemanticAnalyzer(diagnostics, symbolTable).analyze(parser.parse());
    }

    private List<Statement> mainBody(String statements) {
        TypedProgram program = analyze("VOID MAIN() {\n" + statements + "\n}");
        return program.functions().get(0).body().statements();
    }

    private CompilerErrorCode errorOf(String source) {
        try {
            analyze(source);
        } catch (CompilerAbortException e) {
            assertThat(diagnostics.hasErrors()).isTrue();
            return e.diagnostic().code();
        }
        throw new AssertionError("Expected a semantic error for: " + source);
    }

    private CompilerErrorCode errorInMain(String statements) {
        return errorOf("VOID MAIN() {\n" + statements + "\n}");
    }

    private static TypedExpression initializerOf(Statement statement) {
        return ((Statement.VarDecl) statement).initializer();
    }

    @Test
    void autoTakesTheInitializerType() {
        List<Statement> body = mainBody(String.join("\n",
                "AUTO I = 1;",
                "AUTO F = 1.5 * 2.0;",
                "AUTO B = I < 3;",
                "AUTO S = \"text\";",
                "AUTO M = [[1, 2, 3], [4, 5, 6]];"));

        assertThat(body).extracting(s -> ((Statement.VarDecl) s).type()).containsExactly(
                Type.INT, Type.FLOAT, Type.BOOL, Type.STRING, new Type.Matrix(Type.INT, 2, 3));
    }

    @Test
    void autoWithoutInitializerIsRejected() {
        assertThat(errorInMain("AUTO X;")).isEqualTo(CompilerErrorCode.AUTO_WITHOUT_INITIALIZER);
    }

    @Test
    void autoFromVoidCallIsRejected() {
        assertThat(errorInMain("AUTO X = PRINT(1);")).isEqualTo(CompilerErrorCode.INVALID_DECLARATION_TYPE);
    }

    @Test
    void autoAndVoidAreNotStorageTypes() {
        assertThat(errorOf("AUTO G;")).isEqualTo(CompilerErrorCode.INVALID_DECLARATION_TYPE);
        assertThat(errorOf("VOID G;")).isEqualTo(CompilerErrorCode.INVALID_DECLARATION_TYPE);
        assertThat(errorOf("VOID F(AUTO X) { }")).isEqualTo(CompilerErrorCode.INVALID_DECLARATION_TYPE);
        assertThat(errorOf("AUTO F() { RETURN 1; }")).isEqualTo(CompilerErrorCode.INVALID_DECLARATION_TYPE);
        assertThat(errorInMain("VOID X;")).isEqualTo(CompilerErrorCode.INVALID_DECLARATION_TYPE);
    }

    @Test
    void matrixOfStringsIsRejected() {
        assertThat(errorOf("MATRIX<STRING, 1, 1> M;")).isEqualTo(CompilerErrorCode.INVALID_DECLARATION_TYPE);
    }

    @Test
    void innerDeclarationShadowsOuter() {
        List<Statement> body = mainBody(String.join("\n",
                "INT X = 1;",
                "{ FLOAT X = 2.0; AUTO Y = X; }",
                "AUTO Z = X;"));

        Statement.Block inner = (Statement.Block) body.get(1);
        assertThat(((Statement.VarDecl) inner.statements().get(1)).type()).isEqualTo(Type.FLOAT);
        assertThat(((Statement.VarDecl) body.get(2)).type()).isEqualTo(Type.INT);
    }

    @Test
    void localShadowsGlobal() {
        TypedProgram program = analyze("BOOL X;\nVOID MAIN() { FLOAT X = 1.0; AUTO Y = X; }");

        Statement y = program.functions().get(0).body().statements().get(1);
        assertThat(((Statement.VarDecl) y).type()).isEqualTo(Type.FLOAT);
    }

    @Test
    void blockScopeEndsWithTheBlock() {
        assertThat(errorInMain("{ INT X = 1; }\nX = 2;")).isEqualTo(CompilerErrorCode.UNDECLARED_IDENTIFIER);
    }

    @Test
    void unbracedBodyDeclarationDoesNotLeak() {
        assertThat(errorInMain("IF (TRUE) INT X = 1;\nX = 2;")).isEqualTo(CompilerErrorCode.UNDECLARED_IDENTIFIER);
    }

    @Test
    void initializerCannotSeeTheVariableItDeclares() {
        assertThat(errorInMain("INT X = X;")).isEqualTo(CompilerErrorCode.UNDECLARED_IDENTIFIER);
    }

    @Test
    void duplicateDeclarationsAreRejected() {
        assertThat(errorInMain("INT X;\nFLOAT X;")).isEqualTo(CompilerErrorCode.DUPLICATE_DECLARATION);
        assertThat(errorOf("INT G;\nINT G;")).isEqualTo(CompilerErrorCode.DUPLICATE_DECLARATION);
        assertThat(errorOf("VOID F() { }\nVOID F() { }")).isEqualTo(CompilerErrorCode.DUPLICATE_DECLARATION);
        assertThat(errorOf("VOID F(INT A, FLOAT A) { }")).isEqualTo(CompilerErrorCode.DUPLICATE_DECLARATION);
        assertThat(errorOf("VOID PRINT(INT A) { }")).isEqualTo(CompilerErrorCode.DUPLICATE_DECLARATION);
    }

    @Test
    void functionsAndVariablesLiveInSeparateNamespaces() {
        TypedProgram program = analyze("INT F;\nINT F() { RETURN F; }");

        assertThat(program.globals()).hasSize(1);
        assertThat(program.functions()).hasSize(1);
    }

    @Test
    void functionsMayCallFunctionsDeclaredLater() {
        TypedProgram program = analyze("INT A() { RETURN B(2); }\nINT B(INT X) { RETURN X; }");

        TypedFunction a = program.functions().get(0);
        Statement.Return ret = (Statement.Return) a.body().statements().get(0);
        assertThat(ret.value().type()).isEqualTo(Type.INT);
        assertThat(ret.value().expression()).isInstanceOfSatisfying(Expression.Call.class,
                call -> assertThat(call.isBuiltin()).isFalse());
    }

    @ParameterizedTest
    @CsvSource({
            "1 + 2, INT",
            "1.0 / 2.0, FLOAT",
            "1 < 2, BOOL",
            "1.0 >= 2.0, BOOL",
            "1 == 2, BOOL",
            "TRUE && FALSE, BOOL",
            "-3, INT",
            "-3.0, FLOAT",
            "!TRUE, BOOL"
    })
    void operatorResultTypes(String expression, String type) {
        Statement decl = mainBody("AUTO R = " + expression + ";").get(0);

        assertThat(initializerOf(decl).type()).isEqualTo(Type.Primitive.valueOf(type));
    }

    @ParameterizedTest
    @CsvSource({
            "1 + 2.0",
            "TRUE + FALSE",
            "1 && 2",
            "\"A\" == \"B\"",
            "-TRUE",
            "!1",
            "[[1]] + [[1]]"
    })
    void invalidOperandsAreRejected(String expression) {
        assertThat(errorInMain("AUTO R = " + expression + ";")).isEqualTo(CompilerErrorCode.INVALID_OPERAND_TYPES);
    }

    @Test
    void assignmentNeedsTheDeclaredType() {
        assertThat(errorInMain("INT X;\nX = 1.0;")).isEqualTo(CompilerErrorCode.TYPE_MISMATCH);
        assertThat(errorInMain("FLOAT X = 1;")).isEqualTo(CompilerErrorCode.TYPE_MISMATCH);
    }

    @Test
    void assignmentHasTheTargetType() {
        Statement statement = mainBody("INT X;\nX = 4;").get(1);

        assertThat(((Statement.Expr) statement).expression().type()).isEqualTo(Type.INT);
    }

    @Test
    void matrixLiteralMustMatchDeclaredShape() {
        assertThat(errorInMain("MATRIX<INT, 2, 2> M = [[1, 2, 3], [4, 5, 6]];"))
                .isEqualTo(CompilerErrorCode.MATRIX_SHAPE_MISMATCH);
        assertThat(errorInMain("MATRIX<FLOAT, 1, 2> M = [[1, 2]];"))
                .isEqualTo(CompilerErrorCode.MATRIX_SHAPE_MISMATCH);
    }

    @Test
    void matrixLiteralElementsFoldNegation() {
        Statement decl = mainBody("MATRIX<FLOAT, 1, 2> M = [[-1.5, 2.0]];").get(0);

        Expression.MatrixLit literal = (Expression.MatrixLit) initializerOf(decl).expression();
        assertThat(literal.rows().get(0).get(0).expression()).isEqualTo(new Expression.FloatLit(-1.5));
    }

    @Test
    void matrixLiteralRulesAreEnforced() {
        assertThat(errorInMain("AUTO M = [[1, 2], [3]];")).isEqualTo(CompilerErrorCode.MATRIX_SHAPE_MISMATCH);
        assertThat(errorInMain("AUTO M = [[1, 2.0]];")).isEqualTo(CompilerErrorCode.TYPE_MISMATCH);
        assertThat(errorInMain("INT X;\nAUTO M = [[X]];")).isEqualTo(CompilerErrorCode.TYPE_MISMATCH);
        assertThat(errorInMain("AUTO M = [[\"S\"]];")).isEqualTo(CompilerErrorCode.TYPE_MISMATCH);
    }

    @Test
    void builtinsCheckTheirArgument() {
        List<Statement> body = mainBody(String.join("\n",
                "MATRIX<BOOL, 3, 4> M;",
                "AUTO R = ROWS(M);",
                "AUTO C = COLS(M);",
                "PRINT(TRUE);",
                "PRINTSTR(\"x\");"));

        assertThat(initializerOf(body.get(1)).type()).isEqualTo(Type.INT);
        assertThat(((Statement.Expr) body.get(3)).expression().type()).isEqualTo(Type.VOID);

        assertThat(errorInMain("PRINT(\"x\");")).isEqualTo(CompilerErrorCode.TYPE_MISMATCH);
        assertThat(errorInMain("PRINTSTR(1);")).isEqualTo(CompilerErrorCode.TYPE_MISMATCH);
        assertThat(errorInMain("AUTO R = ROWS(1);")).isEqualTo(CompilerErrorCode.TYPE_MISMATCH);
        assertThat(errorInMain("PRINT(1, 2);")).isEqualTo(CompilerErrorCode.ARITY_MISMATCH);
    }

    @Test
    void callsAreCheckedAgainstTheSignature() {
        String callee = "INT ADD(INT A, INT B) { RETURN A + B; }\n";

        assertThat(errorOf(callee + "VOID MAIN() { ADD(1); }")).isEqualTo(CompilerErrorCode.ARITY_MISMATCH);
        assertThat(errorOf(callee + "VOID MAIN() { ADD(1, 2.0); }")).isEqualTo(CompilerErrorCode.TYPE_MISMATCH);
        assertThat(errorOf("VOID MAIN() { NOPE(); }")).isEqualTo(CompilerErrorCode.UNDECLARED_FUNCTION);
    }

    @Test
    void returnMustMatchTheFunction() {
        assertThat(errorOf("INT F() { RETURN 1.0; }")).isEqualTo(CompilerErrorCode.RETURN_TYPE_MISMATCH);
        assertThat(errorOf("INT F() { RETURN; }")).isEqualTo(CompilerErrorCode.RETURN_TYPE_MISMATCH);
        assertThat(errorOf("VOID F() { RETURN 1; }")).isEqualTo(CompilerErrorCode.RETURN_TYPE_MISMATCH);
        assertThat(analyze("VOID F() { RETURN; }").functions()).hasSize(1);
    }

    @Test
    void conditionsMustBeBool() {
        assertThat(errorInMain("IF (1) { }")).isEqualTo(CompilerErrorCode.TYPE_MISMATCH);
        assertThat(errorInMain("WHILE (1.0) { }")).isEqualTo(CompilerErrorCode.TYPE_MISMATCH);
        assertThat(errorInMain("INT I;\nFOR (I = 0; I; I = I + 1) { }")).isEqualTo(CompilerErrorCode.TYPE_MISMATCH);
    }

    @Test
    void forGetsItsOwnScope() {
        Statement statement = mainBody("INT I;\nFOR (I = 0; I < 3; I = I + 1) INT J = I;").get(1);

        Statement.For loop = (Statement.For) statement;
        assertThat(symbolTable.getScope(loop.scopeId()).parentId()).isNotEqualTo(SymbolTable.NO_PARENT);
        Statement.Block body = (Statement.Block) loop.body();
        assertThat(symbolTable.getScope(body.scopeId()).parentId()).isEqualTo(loop.scopeId());
        assertThat(symbolTable.getScope(body.scopeId()).symbols()).containsKey("J");
    }

    @Test
    void undeclaredIdentifierIsReported() {
        assertThatErrorPointsAt("VOID MAIN() {\n  Y = 1;\n}", 2);
    }

    private void assertThatErrorPointsAt(String source, int line) {
        try {
            analyze(source);
        } catch (CompilerAbortException e) {
            assertThat(e.diagnostic().code()).isEqualTo(CompilerErrorCode.UNDECLARED_IDENTIFIER);
            assertThat(e.diagnostic().lineNumber()).isEqualTo(line);
            assertThat(e.diagnostic().fileName()).isEqualTo("test.mat");
            return;
        }
        throw new AssertionError("Expected an error");
    }
}
