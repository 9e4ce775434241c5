package org.automatic.compiler.frontend.preprocessor.features.include;

import org.automatic.compiler.api.CompilerErrorCode;
import org.automatic.compiler.diagnostics.CompilerLogger;
import org.automatic.compiler.frontend.lexer.Token;
import org.automatic.compiler.frontend.lexer.TokenType;
import org.automatic.compiler.frontend.preprocessor.IPreProcessorDirectiveHandler;
import org.automatic.compiler.frontend.preprocessor.ISourceResolver;
import org.automatic.compiler.frontend.preprocessor.PreProcessor;
import org.automatic.compiler.frontend.preprocessor.PreProcessorContext;

import java.io.IOException;
import java.util.Optional;

/**
 * Handles the <code>#INCLUDE "file"</code> directive.
 * The named unit is resolved through the preprocessor's {@link ISourceResolver} and its tokens are
 * spliced at the position of the directive. A unit that was already spliced is skipped.
 */
public class IncludeDirectiveHandler implements IPreProcessorDirectiveHandler {

    @Override
    public void process(Token directive, PreProcessor preProcessor, PreProcessorContext preProcessorContext) {
        Token pathToken = preProcessor.expectArgument(directive, TokenType.STRING, "a file path in quotes");
        preProcessor.expectEndOfDirective(directive);

        String target = (String) pathToken.value();
        Optional<ISourceResolver.ResolvedSource> resolved;
        try {
            resolved = preProcessor.getSourceResolver().resolve(target, preProcessor.currentUnitName());
        } catch (IOException e) {
            throw preProcessor.error(CompilerErrorCode.IO_ERROR_READING_FILE,
                    "Could not read included file '" + target + "': " + e.getMessage(), pathToken);
        }
        if (resolved.isEmpty()) {
            throw preProcessor.error(CompilerErrorCode.UNRESOLVED_INCLUDE,
                    "Cannot resolve included file '" + target + "'.", pathToken);
        }

        ISourceResolver.ResolvedSource unit = resolved.get();
        if (!preProcessorContext.markIncluded(unit.logicalName())) {
            CompilerLogger.debug("Include: '{}' already spliced, skipping", unit.logicalName());
            return;
        }
        CompilerLogger.debug("Include: splicing '{}' from {}:{}", unit.logicalName(), pathToken.fileName(), pathToken.line());
        preProcessor.pushUnit(directive, unit);
    }
}
