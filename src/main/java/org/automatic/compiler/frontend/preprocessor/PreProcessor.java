package org.automatic.compiler.frontend.preprocessor;

import org.automatic.compiler.api.CompilerErrorCode;
import org.automatic.compiler.diagnostics.CompilerAbortException;
import org.automatic.compiler.diagnostics.CompilerLogger;
import org.automatic.compiler.diagnostics.DiagnosticsEngine;
import org.automatic.compiler.frontend.lexer.Lexer;
import org.automatic.compiler.frontend.lexer.Token;
import org.automatic.compiler.frontend.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * The preprocessor runs interleaved with the lexer. It pulls tokens from the lexer of the
 * innermost active unit, dispatches directives to their handlers, replaces macro uses by their
 * values and collects everything else into one flat token stream for the parser.
 * <p>
 * Included units are spliced by pushing their lexer on a stack, so their tokens appear exactly
 * where the {@code #INCLUDE} stood. Regions excluded by a conditional are skipped by the lexer
 * as raw text and never tokenized.
 */
public class PreProcessor {

    private final Deque<Lexer> units = new ArrayDeque<>();
    private final DiagnosticsEngine diagnostics;
    private final ISourceResolver sourceResolver;
    private final int maxIncludeDepth;
    private final DirectiveHandlerRegistry directiveRegistry;
    private final PreProcessorContext ppContext = new PreProcessorContext();
    private final List<Token> output = new ArrayList<>();

    /**
     * Constructs a new PreProcessor.
     * @param mainUnit The lexer of the main unit.
     * @param diagnostics The engine for reporting errors.
     * @param sourceResolver Finds the units named by {@code #INCLUDE}.
     * @param maxIncludeDepth The maximum nesting of included units.
     */
    public PreProcessor(Lexer mainUnit, DiagnosticsEngine diagnostics, ISourceResolver sourceResolver, int maxIncludeDepth) {
        this.diagnostics = diagnostics;
        this.sourceResolver = sourceResolver;
        this.maxIncludeDepth = maxIncludeDepth;
        this.directiveRegistry = DirectiveHandlerRegistry.initialize();
        this.units.push(mainUnit);
        ppContext.markIncluded(mainUnit.getLogicalFileName());
    }

    /**
     * Runs the preprocessor over the main unit and everything it includes.
     * @return The final token stream, ending with a single {@link TokenType#END_OF_FILE}.
     * @throws CompilerAbortException on the first lexical error.
     */
    public List<Token> expand() {
        Token last = null;
        while (!units.isEmpty()) {
            Lexer unit = units.peek();
            Token token = unit.nextToken();
            last = token;

            if (token.type() == TokenType.END_OF_FILE) {
                finishUnit(unit);
                continue;
            }
            if (token.type().isDirective()) {
                Optional<IPreProcessorDirectiveHandler> handler = directiveRegistry.get(token.type());
                if (handler.isEmpty()) {
                    throw error(CompilerErrorCode.MALFORMED_DIRECTIVE, "Unsupported directive '" + token.text() + "'.", token);
                }
                handler.get().process(token, this, ppContext);
                continue;
            }
            if (token.type() == TokenType.IDENTIFIER) {
                Optional<MacroDefinition> macro = ppContext.getMacro(token.text());
                if (macro.isPresent() && macro.get().hasValue()) {
                    output.add(macro.get().value().relocatedTo(token));
                    continue;
                }
            }
            output.add(token);
        }
        output.add(last);
        CompilerLogger.debug("Preprocessor: {} tokens from units {}", output.size(), ppContext.getIncludedUnits());
        return output;
    }

    private void finishUnit(Lexer unit) {
        Optional<Token> open = ppContext.innermostConditional();
        if (open.isPresent() && open.get().fileName().equals(unit.getLogicalFileName())) {
            throw error(CompilerErrorCode.UNBALANCED_CONDITIONAL,
                    "Conditional '" + open.get().text() + "' is not closed by #END.", open.get());
        }
        units.pop();
    }

    /**
     * Reads the next non-whitespace token of the current directive line.
     * Line-end and end-of-file tokens are returned as they are, not consumed past.
     * @return The next argument token.
     */
    public Token nextArgument() {
        Lexer unit = units.peek();
        Token token = unit.nextToken();
        while (token.type() == TokenType.WHITESPACE) {
            token = unit.nextToken();
        }
        return token;
    }

    /**
     * Reads a required argument of the given type.
     * @param directive The directive being processed.
     * @param type The required token type.
     * @param what A description of the argument for the error message.
     * @return The argument token.
     */
    public Token expectArgument(Token directive, TokenType type, String what) {
        Token token = nextArgument();
        if (token.type() != type) {
            throw error(CompilerErrorCode.MALFORMED_DIRECTIVE,
                    "Expected " + what + " after #" + directive.value() + ".", directive);
        }
        return token;
    }

    /**
     * Consumes the rest of the directive line, which must be empty.
     * The line-end itself is kept in the output to preserve line structure.
     * @param directive The directive being processed.
     */
    public void expectEndOfDirective(Token directive) {
        endDirectiveLine(directive, nextArgument());
    }

    /**
     * Checks that a token already read ends the directive line.
     * @param directive The directive being processed.
     * @param token The token following the arguments.
     */
    public void endDirectiveLine(Token directive, Token token) {
        if (token.type() == TokenType.NEWLINE) {
            output.add(token);
        } else if (token.type() != TokenType.END_OF_FILE) {
            throw error(CompilerErrorCode.MALFORMED_DIRECTIVE,
                    "Unexpected '" + token.text() + "' after #" + directive.value() + ".", token);
        }
    }

    /**
     * Skips the region following a false conditional.
     * @param directive The conditional directive.
     */
    public void skipExcludedRegion(Token directive) {
        if (!units.peek().skipExcludedRegion()) {
            throw error(CompilerErrorCode.UNBALANCED_CONDITIONAL,
                    "Conditional '" + directive.text() + "' is not closed by #END.", directive);
        }
    }

    /**
     * Splices another unit at the current position.
     * @param directive The include directive, used for diagnostics.
     * @param unit The resolved unit.
     */
    public void pushUnit(Token directive, ISourceResolver.ResolvedSource unit) {
        if (units.size() > maxIncludeDepth) {
            throw error(CompilerErrorCode.INCLUDE_DEPTH_EXCEEDED,
                    "Includes nested deeper than " + maxIncludeDepth + " levels.", directive);
        }
        units.push(new Lexer(unit.content(), diagnostics, unit.logicalName()));
    }

    /**
     * @return The logical name of the unit being read.
     */
    public String currentUnitName() {
        return units.peek().getLogicalFileName();
    }

    /**
     * @return The resolver for include targets.
     */
    public ISourceResolver getSourceResolver() {
        return sourceResolver;
    }

    /**
     * Records a lexical error at the given token.
     * @param code The error code.
     * @param message The message.
     * @param at The token the error refers to.
     * @return The exception to throw.
     */
    public CompilerAbortException error(CompilerErrorCode code, String message, Token at) {
        return diagnostics.abort(code, message, at.fileName(), at.line());
    }

    /**
     * Records a warning at the given token; preprocessing continues.
     * @param message The message.
     * @param at The token the warning refers to.
     */
    public void warning(String message, Token at) {
        diagnostics.reportWarning(message, at.fileName(), at.line());
        CompilerLogger.warn("{}:{}: {}", at.fileName(), at.line(), message);
    }

    /**
     * Gets the shared context for the preprocessor.
     * @return The preprocessor context.
     */
    public PreProcessorContext getPreProcessorContext() {
        return ppContext;
    }
}
