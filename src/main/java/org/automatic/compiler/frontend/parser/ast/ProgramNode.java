package org.automatic.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * The root of the AST: the top-level globals and functions in source order.
 *
 * @param declarations {@link GlobalVariableNode}s and {@link FunctionNode}s.
 */
public record ProgramNode(List<AstNode> declarations) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return declarations;
    }

    /**
     * @return The global variable declarations in source order.
     */
    public List<GlobalVariableNode> globals() {
        List<GlobalVariableNode> globals = new ArrayList<>();
        for (AstNode node : declarations) {
            if (node instanceof GlobalVariableNode global) globals.add(global);
        }
        return globals;
    }

    /**
     * @return The functions in source order.
     */
    public List<FunctionNode> functions() {
        List<FunctionNode> functions = new ArrayList<>();
        for (AstNode node : declarations) {
            if (node instanceof FunctionNode function) functions.add(function);
        }
        return functions;
    }
}
