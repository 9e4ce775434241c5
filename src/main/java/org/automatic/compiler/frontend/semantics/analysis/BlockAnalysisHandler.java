package org.automatic.compiler.frontend.semantics.analysis;

import org.automatic.compiler.frontend.parser.ast.BlockNode;
import org.automatic.compiler.frontend.parser.ast.StatementNode;
import org.automatic.compiler.frontend.semantics.SemanticAnalyzer;
import org.automatic.compiler.frontend.semantics.tree.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles braced blocks. Each block opens a new scope nested in the enclosing one.
 */
public class BlockAnalysisHandler implements IAnalysisHandler {

    /**
     * {@inheritDoc}
     */
    @Override
    public Statement analyze(StatementNode node, int scopeId, SemanticAnalyzer analyzer) {
        BlockNode block = (BlockNode) node;
        int blockScope = analyzer.getSymbolTable().createScope(scopeId);
        List<Statement> statements = new ArrayList<>();
        for (StatementNode statement : block.statements()) {
            statements.add(analyzer.analyzeStatement(statement, blockScope));
        }
        return new Statement.Block(statements, blockScope);
    }
}
