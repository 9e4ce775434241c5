package org.automatic.compiler.frontend.parser.ast;

import org.automatic.compiler.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * A matrix literal {@code [[a, b], [c, d]]}. Shape and elements are checked by the analyzer.
 *
 * @param openBracket The outer opening bracket.
 * @param rows The rows, each a list of element expressions.
 */
public record MatrixLiteralNode(Token openBracket, List<List<ExpressionNode>> rows) implements ExpressionNode {

    @Override
    public Token anchor() {
        return openBracket;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        rows.forEach(children::addAll);
        return children;
    }
}
