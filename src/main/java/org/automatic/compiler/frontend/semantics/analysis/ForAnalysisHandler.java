package org.automatic.compiler.frontend.semantics.analysis;

import org.automatic.compiler.frontend.parser.ast.ForNode;
import org.automatic.compiler.frontend.parser.ast.StatementNode;
import org.automatic.compiler.frontend.semantics.SemanticAnalyzer;
import org.automatic.compiler.frontend.semantics.tree.Statement;
import org.automatic.compiler.frontend.semantics.tree.TypedExpression;

/**
 * Handles FOR. The three clauses share a loop scope; the body is nested inside it, so the
 * update sees the same variables as the loop body's enclosing statement.
 */
public class ForAnalysisHandler implements IAnalysisHandler {

    @Override
    public Statement analyze(StatementNode node, int scopeId, SemanticAnalyzer analyzer) {
        ForNode forNode = (ForNode) node;
        int loopScope = analyzer.getSymbolTable().createScope(scopeId);
        TypedExpression init = analyzer.analyzeExpression(forNode.init(), loopScope);
        TypedExpression condition = analyzer.analyzeCondition(forNode.condition(), loopScope, "FOR");
        TypedExpression update = analyzer.analyzeExpression(forNode.update(), loopScope);
        Statement body = analyzer.analyzeNested(forNode.body(), loopScope);
        return new Statement.For(init, condition, update, body, loopScope);
    }
}
