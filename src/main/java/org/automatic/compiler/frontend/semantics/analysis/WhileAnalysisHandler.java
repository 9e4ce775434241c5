package org.automatic.compiler.frontend.semantics.analysis;

import org.automatic.compiler.frontend.parser.ast.StatementNode;
import org.automatic.compiler.frontend.parser.ast.WhileNode;
import org.automatic.compiler.frontend.semantics.SemanticAnalyzer;
import org.automatic.compiler.frontend.semantics.tree.Statement;
import org.automatic.compiler.frontend.semantics.tree.TypedExpression;

public class WhileAnalysisHandler implements IAnalysisHandler {

    @Override
    public Statement analyze(StatementNode node, int scopeId, SemanticAnalyzer analyzer) {
        WhileNode whileNode = (WhileNode) node;
        TypedExpression condition = analyzer.analyzeCondition(whileNode.condition(), scopeId, "WHILE");
        return new Statement.While(condition, analyzer.analyzeNested(whileNode.body(), scopeId));
    }
}
