package org.automatic.compiler.frontend.preprocessor;

import org.automatic.compiler.frontend.lexer.Token;

/**
 * A macro introduced by {@code #DEFINE}.
 *
 * @param name The token of the macro name.
 * @param value The single replacement token, or {@code null} for a plain flag used by
 *              {@code #IFDEF}/{@code #IFNDEF}.
 */
public record MacroDefinition(Token name, Token value) {

    /**
     * @return {@code true} if uses of the name are replaced by a value.
     */
    public boolean hasValue() {
        return value != null;
    }
}
