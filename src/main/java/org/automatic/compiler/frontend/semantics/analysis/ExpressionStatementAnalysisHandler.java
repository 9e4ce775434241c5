package org.automatic.compiler.frontend.semantics.analysis;

import org.automatic.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.automatic.compiler.frontend.parser.ast.StatementNode;
import org.automatic.compiler.frontend.semantics.SemanticAnalyzer;
import org.automatic.compiler.frontend.semantics.tree.Statement;

/**
 * Handles expressions evaluated for their effect, including the empty statement.
 */
public class ExpressionStatementAnalysisHandler implements IAnalysisHandler {

    @Override
    public Statement analyze(StatementNode node, int scopeId, SemanticAnalyzer analyzer) {
        ExpressionStatementNode statement = (ExpressionStatementNode) node;
        return new Statement.Expr(analyzer.analyzeExpression(statement.expression(), scopeId));
    }
}
