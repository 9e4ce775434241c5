package org.automatic.compiler.frontend.semantics.analysis;

import org.automatic.compiler.frontend.parser.ast.IfNode;
import org.automatic.compiler.frontend.parser.ast.StatementNode;
import org.automatic.compiler.frontend.semantics.SemanticAnalyzer;
import org.automatic.compiler.frontend.semantics.tree.Statement;
import org.automatic.compiler.frontend.semantics.tree.TypedExpression;

public class IfAnalysisHandler implements IAnalysisHandler {

    @Override
    public Statement analyze(StatementNode node, int scopeId, SemanticAnalyzer analyzer) {
        IfNode ifNode = (IfNode) node;
        TypedExpression condition = analyzer.analyzeCondition(ifNode.condition(), scopeId, "IF");
        Statement thenBranch = analyzer.analyzeNested(ifNode.thenBranch(), scopeId);
        Statement elseBranch = ifNode.elseBranch() == null ? null : analyzer.analyzeNested(ifNode.elseBranch(), scopeId);
        return new Statement.If(condition, thenBranch, elseBranch);
    }
}
