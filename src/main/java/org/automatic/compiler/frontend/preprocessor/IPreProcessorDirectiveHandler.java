package org.automatic.compiler.frontend.preprocessor;

import org.automatic.compiler.frontend.lexer.Token;

/**
 * Handler interface for directives processed during preprocessing.
 * Handlers read their arguments from the current unit and change the token stream
 * (splicing units, defining macros, excluding regions) before the parser sees it.
 */
public interface IPreProcessorDirectiveHandler {

    /**
     * Processes one directive. The directive keyword token has already been consumed.
     *
     * @param directive           The directive keyword token.
     * @param preProcessor        The preprocessor, providing access to the current unit.
     * @param preProcessorContext The shared preprocessor state (macro definitions, open conditionals).
     */
    void process(Token directive, PreProcessor preProcessor, PreProcessorContext preProcessorContext);
}
