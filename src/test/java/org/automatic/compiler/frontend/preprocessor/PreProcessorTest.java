package org.automatic.compiler.frontend.preprocessor;

import org.automatic.compiler.api.CompilerErrorCode;
import org.automatic.compiler.diagnostics.CompilerAbortException;
import org.automatic.compiler.diagnostics.Diagnostic;
import org.automatic.compiler.diagnostics.DiagnosticsEngine;
import org.automatic.compiler.frontend.lexer.Lexer;
import org.automatic.compiler.frontend.lexer.Token;
import org.automatic.compiler.frontend.lexer.TokenType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the {@link PreProcessor}: macros, conditional regions and include splicing.
 */
@ExtendWith(MockitoExtension.class)
class PreProcessorTest {

    @TempDir
    Path tempDir;

    private DiagnosticsEngine diagnostics;
    @Mock
    private ISourceResolver resolver;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
    }

    private List<Token> expand(String source) {
        return expand(source, resolver, 16);
    }

    private List<Token> expand(String source, ISourceResolver sourceResolver, int maxDepth) {
        Lexer lexer = new Lexer(source, diagnostics, "main.mat");
        return new PreProcessor(lexer, diagnostics, sourceResolver, maxDepth).expand();
    }

    private static String significantText(List<Token> tokens) {
        return tokens.stream()
                .filter(t -> !t.isLayout() && t.type() != TokenType.END_OF_FILE)
                .map(Token::text)
                .collect(Collectors.joining(" "));
    }

    private static CompilerErrorCode codeOf(Throwable e) {
        return ((CompilerAbortException) e).diagnostic().code();
    }

    @Test
    @Tag("unit")
    void outputEndsWithSingleEndOfFile() {
        List<Token> tokens = expand("INT X;");

        assertThat(tokens.get(tokens.size() - 1).type()).isEqualTo(TokenType.END_OF_FILE);
        assertThat(tokens).filteredOn(t -> t.type() == TokenType.END_OF_FILE).hasSize(1);
    }

    @Test
    @Tag("unit")
    void defineReplacesLaterUsesAtTheUseSite() {
        List<Token> tokens = expand("#DEFINE SIZE 10\nINT X = SIZE;");

        assertThat(significantText(tokens)).isEqualTo("INT X = 10 ;");
        Token replaced = tokens.stream().filter(t -> t.text().equals("10")).findFirst().orElseThrow();
        assertThat(replaced.type()).isEqualTo(TokenType.INTEGER);
        assertThat(replaced.value()).isEqualTo(10);
        assertThat(replaced.line()).isEqualTo(2);
    }

    @Test
    @Tag("unit")
    void directiveLineKeepsItsLineEnd() {
        List<Token> tokens = expand("#DEFINE A\nX");

        assertThat(tokens).extracting(Token::type)
                .containsExactly(TokenType.NEWLINE, TokenType.IDENTIFIER, TokenType.END_OF_FILE);
    }

    @Test
    @Tag("unit")
    void macroValuesAreNotRescanned() {
        List<Token> tokens = expand("#DEFINE A B\n#DEFINE B 1\nA B");

        assertThat(significantText(tokens)).isEqualTo("B 1");
    }

    @Test
    @Tag("unit")
    void undefRemovesMacro() {
        List<Token> tokens = expand("#DEFINE A 1\n#UNDEF A\nA");

        assertThat(significantText(tokens)).isEqualTo("A");
    }

    @Test
    @Tag("unit")
    void redefinitionReplacesMacroWithWarning() {
        List<Token> tokens = expand("#DEFINE A 1\n#DEFINE A 2\nA");

        assertThat(significantText(tokens)).isEqualTo("2");
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.getDiagnostics()).singleElement()
                .satisfies(d -> {
                    assertThat(d.type()).isEqualTo(Diagnostic.Type.WARNING);
                    assertThat(d.lineNumber()).isEqualTo(2);
                    assertThat(d.message()).contains("'A'");
                });
    }

    @Test
    @Tag("unit")
    void macroWithoutValueLeavesUsesAlone() {
        List<Token> tokens = expand("#DEFINE FLAG\nFLAG");

        assertThat(significantText(tokens)).isEqualTo("FLAG");
    }

    @Test
    @Tag("unit")
    void ifdefIncludesOrSkipsByDefinedness() {
        String source = String.join("\n",
                "#DEFINE DEBUG",
                "#IFDEF DEBUG",
                "A",
                "#END",
                "#IFNDEF DEBUG",
                "B",
                "#END",
                "#IFDEF RELEASE",
                "C",
                "#END",
                "D");

        assertThat(significantText(expand(source))).isEqualTo("A D");
    }

    @Test
    @Tag("unit")
    void skippedRegionIsNeverTokenized() {
        String source = String.join("\n",
                "#IFDEF MISSING",
                "\"unterminated",
                "#BOGUS",
                "#IFNDEF INNER",
                "#END",
                "#END",
                "X");

        assertThat(significantText(expand(source))).isEqualTo("X");
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    @Tag("unit")
    void endWithoutConditionalIsUnbalanced() {
        assertThatThrownBy(() -> expand("X\n#END"))
                .isInstanceOf(CompilerAbortException.class)
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(CompilerErrorCode.UNBALANCED_CONDITIONAL));
    }

    @Test
    @Tag("unit")
    void unitEndingInsideIncludedConditionalIsUnbalanced() {
        assertThatThrownBy(() -> expand("#IFNDEF X\nA\n"))
                .isInstanceOf(CompilerAbortException.class)
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(CompilerErrorCode.UNBALANCED_CONDITIONAL));
    }

    @Test
    @Tag("unit")
    void unitEndingInsideSkippedConditionalIsUnbalanced() {
        assertThatThrownBy(() -> expand("#IFDEF X\nA\n"))
                .isInstanceOf(CompilerAbortException.class)
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(CompilerErrorCode.UNBALANCED_CONDITIONAL));
    }

    @Test
    @Tag("unit")
    void defineWithTwoValuesIsMalformed() {
        assertThatThrownBy(() -> expand("#DEFINE A 1 2\n"))
                .isInstanceOf(CompilerAbortException.class)
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(CompilerErrorCode.MALFORMED_DIRECTIVE));
    }

    @Test
    @Tag("unit")
    void includeWithoutPathIsMalformed() {
        assertThatThrownBy(() -> expand("#INCLUDE LIB\n"))
                .isInstanceOf(CompilerAbortException.class)
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(CompilerErrorCode.MALFORMED_DIRECTIVE));
    }

    @Test
    @Tag("unit")
    void includeSplicesResolvedUnitInPlace() throws IOException {
        when(resolver.resolve(eq("lib.mat"), eq("main.mat")))
                .thenReturn(Optional.of(new ISourceResolver.ResolvedSource("lib.mat", "INT G;\n")));

        List<Token> tokens = expand("A\n#INCLUDE \"lib.mat\"\nB");

        assertThat(significantText(tokens)).isEqualTo("A INT G ; B");
        Token g = tokens.stream().filter(t -> t.text().equals("G")).findFirst().orElseThrow();
        assertThat(g.fileName()).isEqualTo("lib.mat");
        assertThat(g.line()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void unitIsSplicedAtMostOnce() throws IOException {
        when(resolver.resolve(eq("lib.mat"), anyString()))
                .thenReturn(Optional.of(new ISourceResolver.ResolvedSource("lib.mat", "L\n")));

        List<Token> tokens = expand("#INCLUDE \"lib.mat\"\n#INCLUDE \"lib.mat\"\nM");

        assertThat(significantText(tokens)).isEqualTo("L M");
        verify(resolver, times(2)).resolve(eq("lib.mat"), anyString());
    }

    @Test
    @Tag("unit")
    void macrosDefinedInIncludedUnitApplyAfterwards() throws IOException {
        when(resolver.resolve(eq("defs.mat"), anyString()))
                .thenReturn(Optional.of(new ISourceResolver.ResolvedSource("defs.mat", "#DEFINE N 3\n")));

        assertThat(significantText(expand("#INCLUDE \"defs.mat\"\nN"))).isEqualTo("3");
    }

    @Test
    @Tag("unit")
    void unresolvedIncludeAborts() throws IOException {
        when(resolver.resolve(anyString(), anyString())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> expand("#INCLUDE \"missing.mat\"\n"))
                .isInstanceOf(CompilerAbortException.class)
                .hasMessageContaining("missing.mat")
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(CompilerErrorCode.UNRESOLVED_INCLUDE));
    }

    @Test
    @Tag("unit")
    void unreadableIncludeAborts() throws IOException {
        when(resolver.resolve(anyString(), anyString())).thenThrow(new IOException("disk on fire"));

        assertThatThrownBy(() -> expand("#INCLUDE \"lib.mat\"\n"))
                .isInstanceOf(CompilerAbortException.class)
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(CompilerErrorCode.IO_ERROR_READING_FILE));
    }

    @Test
    @Tag("unit")
    void includesNestedTooDeeplyAbort() throws IOException {
        when(resolver.resolve(eq("a.mat"), anyString()))
                .thenReturn(Optional.of(new ISourceResolver.ResolvedSource("a.mat", "#INCLUDE \"b.mat\"\n")));
        when(resolver.resolve(eq("b.mat"), anyString()))
                .thenReturn(Optional.of(new ISourceResolver.ResolvedSource("b.mat", "B\n")));

        assertThat(significantText(expand("#INCLUDE \"a.mat\"\n", resolver, 2))).isEqualTo("B");

        diagnostics = new DiagnosticsEngine();
        assertThatThrownBy(() -> expand("#INCLUDE \"a.mat\"\n", resolver, 1))
                .isInstanceOf(CompilerAbortException.class)
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(CompilerErrorCode.INCLUDE_DEPTH_EXCEEDED));
    }

    @Test
    @Tag("unit")
    void endInIncludedUnitCannotCloseOuterConditional() throws IOException {
        when(resolver.resolve(eq("close.mat"), anyString()))
                .thenReturn(Optional.of(new ISourceResolver.ResolvedSource("close.mat", "#END\n")));

        assertThatThrownBy(() -> expand("#IFNDEF X\n#INCLUDE \"close.mat\"\n#END\n"))
                .isInstanceOf(CompilerAbortException.class)
                .satisfies(e -> assertThat(((CompilerAbortException) e).diagnostic().fileName()).isEqualTo("close.mat"))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(CompilerErrorCode.UNBALANCED_CONDITIONAL));
    }

    /**
     * Resolves includes relative to the including file on disk.
     */
    @Test
    @Tag("integration")
    void fileSystemResolverFindsSiblingAndIncludePathFiles() throws IOException {
        Path libDir = Files.createDirectories(tempDir.resolve("lib"));
        Files.writeString(tempDir.resolve("sibling.mat"), "S\n");
        Files.writeString(libDir.resolve("shared.mat"), "T\n");
        Path main = tempDir.resolve("main.mat");

        Lexer lexer = new Lexer("#INCLUDE \"sibling.mat\"\n#INCLUDE \"shared.mat\"\nU", diagnostics,
                main.toString().replace('\\', '/'));
        PreProcessor preProcessor = new PreProcessor(lexer, diagnostics, new FileSystemSourceResolver(List.of(libDir)), 16);

        List<Token> tokens = preProcessor.expand();

        assertThat(significantText(tokens)).isEqualTo("S T U");
        assertThat(preProcessor.getPreProcessorContext().getIncludedUnits()).hasSize(3);
    }

    @Test
    @Tag("integration")
    void fileSystemResolverReportsMissingFileAsEmpty() throws IOException {
        FileSystemSourceResolver fileResolver = new FileSystemSourceResolver(List.of(tempDir));

        assertThat(fileResolver.resolve("nowhere.mat", tempDir.resolve("main.mat").toString())).isEmpty();
    }

    @Test
    @Tag("integration")
    void fileSystemResolverTreatsUnnameablePathAsMissing() throws IOException {
        FileSystemSourceResolver fileResolver = new FileSystemSourceResolver(List.of(tempDir));

        assertThat(fileResolver.resolve("a\u0000b.mat", tempDir.resolve("main.mat").toString())).isEmpty();
    }

    @Test
    @Tag("integration")
    void includeOfUnnameablePathIsUnresolved() {
        assertThatThrownBy(() -> expand("#INCLUDE \"a\u0000b.mat\"\nINT X;\n",
                new FileSystemSourceResolver(List.of(tempDir)), 16))
                .isInstanceOf(CompilerAbortException.class)
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(CompilerErrorCode.UNRESOLVED_INCLUDE));
    }
}
