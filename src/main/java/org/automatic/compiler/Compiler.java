package org.automatic.compiler;

import com.typesafe.config.Config;
import org.automatic.compiler.api.CompilationException;
import org.automatic.compiler.api.ICompiler;
import org.automatic.compiler.api.ProgramArtifact;
import org.automatic.compiler.codegen.CodeGenerator;
import org.automatic.compiler.config.CompilerSettings;
import org.automatic.compiler.config.ConfigLoader;
import org.automatic.compiler.config.LoggingConfigurator;
import org.automatic.compiler.diagnostics.CompilerAbortException;
import org.automatic.compiler.diagnostics.CompilerLogger;
import org.automatic.compiler.diagnostics.DiagnosticsEngine;
import org.automatic.compiler.frontend.lexer.Lexer;
import org.automatic.compiler.frontend.lexer.Token;
import org.automatic.compiler.frontend.parser.Parser;
import org.automatic.compiler.frontend.parser.ast.ProgramNode;
import org.automatic.compiler.frontend.preprocessor.FileSystemSourceResolver;
import org.automatic.compiler.frontend.preprocessor.ISourceResolver;
import org.automatic.compiler.frontend.preprocessor.PreProcessor;
import org.automatic.compiler.frontend.semantics.SemanticAnalyzer;
import org.automatic.compiler.frontend.semantics.SymbolTable;
import org.automatic.compiler.frontend.semantics.tree.TypedProgram;
import org.automatic.compiler.ir.IrModule;
import org.automatic.compiler.util.DebugDump;

import java.util.List;

/**
 * The main compiler implementation. This class orchestrates the pipeline from source text to
 * an IR module: lexing and preprocessing, parsing, semantic analysis and code generation.
 * <p>
 * Every call to {@link #compile(String, String)} starts from fresh state, so one instance can
 * compile several programs in sequence. It is not thread-safe.
 */
public class Compiler implements ICompiler {

    private final CompilerSettings settings;
    private final ISourceResolver sourceResolver;
    private int verbosity = -1;
    private DiagnosticsEngine lastDiagnostics = new DiagnosticsEngine();

    /**
     * Creates a compiler from the loaded configuration (see {@link ConfigLoader}) and applies its
     * logging block.
     */
    public Compiler() {
        this(configure(ConfigLoader.load()));
    }

    /**
     * @param settings The compiler settings.
     */
    public Compiler(CompilerSettings settings) {
        this(settings, new FileSystemSourceResolver(settings.includePaths()));
    }

    /**
     * @param settings The compiler settings.
     * @param sourceResolver Finds the units named by {@code #INCLUDE}.
     */
    public Compiler(CompilerSettings settings, ISourceResolver sourceResolver) {
        this.settings = settings;
        this.sourceResolver = sourceResolver;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public ProgramArtifact compile(String source, String programName) throws CompilationException {
        CompilerLogger.setLevel(verbosity >= 0 ? verbosity : settings.verbosity());
        CompilerLogger.info("Compiler: {}", programName);

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        lastDiagnostics = diagnostics;
        try {
            // Phase 1: Lexing and preprocessing (includes, macros, conditionals)
            Lexer mainUnit = new Lexer(source, diagnostics, programName);
            PreProcessor preProcessor = new PreProcessor(mainUnit, diagnostics, sourceResolver, settings.maxIncludeDepth());
            List<Token> tokens = preProcessor.expand();
            CompilerLogger.debug("Preprocessor: {} tokens", tokens.size());

            // Phase 2: Parsing
            ProgramNode ast = new Parser(tokens, diagnostics).parse();

            // Phase 3: Semantic analysis (scopes, inference, type checking)
            TypedProgram typed = new SemanticAnalyzer(diagnostics, new SymbolTable()).analyze(ast);

            // Phase 4: Code generation
            IrModule module = new CodeGenerator(diagnostics).generate(typed, settings.moduleName());

            ProgramArtifact artifact = new ProgramArtifact(programName, module);
            if (settings.debugDump()) {
                DebugDump.dumpProgramArtifact(artifact);
            }
            CompilerLogger.debug("Compiler: {} done, {} functions", programName, module.functions().size());
            return artifact;
        } catch (CompilerAbortException e) {
            CompilerLogger.debug("Compiler: {} aborted: {}", programName, e.getMessage());
            throw new CompilationException(e.diagnostic(), e);
        }
    }

    private static CompilerSettings configure(Config config) {
        LoggingConfigurator.configure(config);
        return CompilerSettings.fromConfig(config);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }

    /**
     * @return The diagnostics of the most recent compilation.
     */
    public DiagnosticsEngine getDiagnostics() {
        return lastDiagnostics;
    }

    /**
     * @return The settings this compiler runs with.
     */
    public CompilerSettings getSettings() {
        return settings;
    }
}
