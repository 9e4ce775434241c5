package org.automatic.compiler.frontend.semantics.analysis;

import org.automatic.compiler.frontend.parser.ast.StatementNode;
import org.automatic.compiler.frontend.semantics.SemanticAnalyzer;
import org.automatic.compiler.frontend.semantics.tree.Statement;

/**
 * Interface for specialized handlers in semantic analysis.
 * Each handler is responsible for analyzing a specific type of statement node.
 */
@FunctionalInterface
public interface IAnalysisHandler {
    /**
     * Analyzes a single statement.
     * @param node The statement to analyze.
     * @param scopeId The scope the statement appears in.
     * @param analyzer The analyzer, for nested statements, expressions and error reporting.
     * @return The typed statement.
     */
    Statement analyze(StatementNode node, int scopeId, SemanticAnalyzer analyzer);
}
