package org.automatic.compiler.frontend.preprocessor.features.conditional;

import org.automatic.compiler.diagnostics.CompilerLogger;
import org.automatic.compiler.frontend.lexer.Token;
import org.automatic.compiler.frontend.lexer.TokenType;
import org.automatic.compiler.frontend.preprocessor.IPreProcessorDirectiveHandler;
import org.automatic.compiler.frontend.preprocessor.PreProcessor;
import org.automatic.compiler.frontend.preprocessor.PreProcessorContext;

/**
 * Handles <code>#IFDEF NAME</code> and <code>#IFNDEF NAME</code>.
 * An included region is tracked as an open conditional until its <code>#END</code>;
 * an excluded region is skipped by the lexer as raw text, including its <code>#END</code>.
 */
public class ConditionalDirectiveHandler implements IPreProcessorDirectiveHandler {

    private final boolean negated;

    /**
     * @param negated {@code true} for <code>#IFNDEF</code>.
     */
    public ConditionalDirectiveHandler(boolean negated) {
        this.negated = negated;
    }

    @Override
    public void process(Token directive, PreProcessor preProcessor, PreProcessorContext preProcessorContext) {
        Token name = preProcessor.expectArgument(directive, TokenType.IDENTIFIER, "a macro name");
        preProcessor.expectEndOfDirective(directive);

        boolean included = preProcessorContext.isDefined(name.text()) != negated;
        if (included) {
            preProcessorContext.openConditional(directive);
        } else {
            CompilerLogger.trace("Conditional: skipping region of #{} {} at {}:{}",
                    directive.value(), name.text(), directive.fileName(), directive.line());
            preProcessor.skipExcludedRegion(directive);
        }
    }
}
