package org.automatic.compiler.frontend.preprocessor.features.define;

import org.automatic.compiler.api.CompilerErrorCode;
import org.automatic.compiler.frontend.lexer.Token;
import org.automatic.compiler.frontend.lexer.TokenType;
import org.automatic.compiler.frontend.preprocessor.IPreProcessorDirectiveHandler;
import org.automatic.compiler.frontend.preprocessor.MacroDefinition;
import org.automatic.compiler.frontend.preprocessor.PreProcessor;
import org.automatic.compiler.frontend.preprocessor.PreProcessorContext;

/**
 * Handles <code>#DEFINE NAME [value]</code>.
 * Without a value the name only becomes defined for <code>#IFDEF</code>/<code>#IFNDEF</code>.
 * With a value (an integer, string or identifier) later uses of the name are replaced by it.
 * Redefining a macro replaces it and is reported as a warning.
 */
public class DefineDirectiveHandler implements IPreProcessorDirectiveHandler {

    @Override
    public void process(Token directive, PreProcessor preProcessor, PreProcessorContext preProcessorContext) {
        Token name = preProcessor.expectArgument(directive, TokenType.IDENTIFIER, "a macro name");
        Token next = preProcessor.nextArgument();

        Token value = null;
        switch (next.type()) {
            case INTEGER, STRING, IDENTIFIER -> {
                value = next;
                preProcessor.expectEndOfDirective(directive);
            }
            case NEWLINE, END_OF_FILE -> preProcessor.endDirectiveLine(directive, next);
            default -> throw preProcessor.error(CompilerErrorCode.MALFORMED_DIRECTIVE,
                    "Macro value must be a single integer, string or identifier.", next);
        }
        if (preProcessorContext.isDefined(name.text())) {
            preProcessor.warning("Macro '" + name.text() + "' is redefined.", name);
        }
        preProcessorContext.registerMacro(new MacroDefinition(name, value));
    }
}
