package org.automatic.compiler.frontend.parser.ast;

/**
 * An AST node that can appear in a function body.
 */
public interface StatementNode extends AstNode {
}
