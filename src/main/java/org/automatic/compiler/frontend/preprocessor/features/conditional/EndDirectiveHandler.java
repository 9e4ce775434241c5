package org.automatic.compiler.frontend.preprocessor.features.conditional;

import org.automatic.compiler.api.CompilerErrorCode;
import org.automatic.compiler.frontend.lexer.Token;
import org.automatic.compiler.frontend.preprocessor.IPreProcessorDirectiveHandler;
import org.automatic.compiler.frontend.preprocessor.PreProcessor;
import org.automatic.compiler.frontend.preprocessor.PreProcessorContext;

/**
 * Handles <code>#END</code>, closing the innermost included conditional region.
 * The conditional must have been opened in the same unit.
 */
public class EndDirectiveHandler implements IPreProcessorDirectiveHandler {

    @Override
    public void process(Token directive, PreProcessor preProcessor, PreProcessorContext preProcessorContext) {
        preProcessor.expectEndOfDirective(directive);
        boolean opensHere = preProcessorContext.innermostConditional()
                .map(open -> open.fileName().equals(directive.fileName()))
                .orElse(false);
        if (!opensHere) {
            throw preProcessor.error(CompilerErrorCode.UNBALANCED_CONDITIONAL,
                    "#END without an open #IFDEF or #IFNDEF.", directive);
        }
        preProcessorContext.closeConditional();
    }
}
