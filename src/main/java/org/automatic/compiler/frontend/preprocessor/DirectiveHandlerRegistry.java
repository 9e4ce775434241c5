package org.automatic.compiler.frontend.preprocessor;

import org.automatic.compiler.frontend.lexer.TokenType;
import org.automatic.compiler.frontend.preprocessor.features.conditional.ConditionalDirectiveHandler;
import org.automatic.compiler.frontend.preprocessor.features.conditional.EndDirectiveHandler;
import org.automatic.compiler.frontend.preprocessor.features.define.DefineDirectiveHandler;
import org.automatic.compiler.frontend.preprocessor.features.define.UndefDirectiveHandler;
import org.automatic.compiler.frontend.preprocessor.features.include.IncludeDirectiveHandler;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry for directive handlers. This class holds a map of directive keywords
 * to their corresponding handlers.
 */
public class DirectiveHandlerRegistry {
    private final Map<TokenType, IPreProcessorDirectiveHandler> handlers = new EnumMap<>(TokenType.class);

    /**
     * Registers a new directive handler.
     * @param directive The directive keyword token type.
     * @param handler The handler for the directive.
     */
    public void register(TokenType directive, IPreProcessorDirectiveHandler handler) {
        handlers.put(directive, handler);
    }

    /**
     * Gets the handler for a given directive.
     * @param directive The directive keyword token type.
     * @return An {@link Optional} containing the handler if it exists, otherwise empty.
     */
    public Optional<IPreProcessorDirectiveHandler> get(TokenType directive) {
        return Optional.ofNullable(handlers.get(directive));
    }

    /**
     * Initializes the directive handler registry with all the built-in handlers.
     * @return A new instance of {@link DirectiveHandlerRegistry} with all handlers registered.
     */
    public static DirectiveHandlerRegistry initialize() {
        DirectiveHandlerRegistry registry = new DirectiveHandlerRegistry();
        registry.register(TokenType.INCLUDE, new IncludeDirectiveHandler());
        registry.register(TokenType.DEFINE, new DefineDirectiveHandler());
        registry.register(TokenType.UNDEF, new UndefDirectiveHandler());
        registry.register(TokenType.IFDEF, new ConditionalDirectiveHandler(false));
        registry.register(TokenType.IFNDEF, new ConditionalDirectiveHandler(true));
        registry.register(TokenType.END, new EndDirectiveHandler());
        return registry;
    }
}
