package org.automatic.compiler.frontend.parser.ast;

import org.automatic.compiler.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * A braced block. It opens a new scope.
 *
 * @param openBrace The opening brace.
 * @param statements The statements of the block.
 */
public record BlockNode(Token openBrace, List<StatementNode> statements) implements StatementNode {

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(statements);
    }
}
