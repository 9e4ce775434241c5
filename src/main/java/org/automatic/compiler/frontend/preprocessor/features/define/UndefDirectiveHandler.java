package org.automatic.compiler.frontend.preprocessor.features.define;

import org.automatic.compiler.frontend.lexer.Token;
import org.automatic.compiler.frontend.lexer.TokenType;
import org.automatic.compiler.frontend.preprocessor.IPreProcessorDirectiveHandler;
import org.automatic.compiler.frontend.preprocessor.PreProcessor;
import org.automatic.compiler.frontend.preprocessor.PreProcessorContext;

/**
 * Handles <code>#UNDEF NAME</code>. Undefining an unknown name is allowed.
 */
public class UndefDirectiveHandler implements IPreProcessorDirectiveHandler {

    @Override
    public void process(Token directive, PreProcessor preProcessor, PreProcessorContext preProcessorContext) {
        Token name = preProcessor.expectArgument(directive, TokenType.IDENTIFIER, "a macro name");
        preProcessor.expectEndOfDirective(directive);
        preProcessorContext.removeMacro(name.text());
    }
}
