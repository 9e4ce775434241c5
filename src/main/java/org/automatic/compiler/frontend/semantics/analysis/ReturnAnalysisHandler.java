package org.automatic.compiler.frontend.semantics.analysis;

import org.automatic.compiler.api.CompilerErrorCode;
import org.automatic.compiler.frontend.parser.ast.NoExprNode;
import org.automatic.compiler.frontend.parser.ast.ReturnNode;
import org.automatic.compiler.frontend.parser.ast.StatementNode;
import org.automatic.compiler.frontend.semantics.SemanticAnalyzer;
import org.automatic.compiler.frontend.semantics.tree.Statement;
import org.automatic.compiler.frontend.semantics.tree.TypedExpression;
import org.automatic.compiler.types.Type;

/**
 * Handles RETURN. VOID functions take a bare RETURN; all others a value of exactly the return type.
 */
public class ReturnAnalysisHandler implements IAnalysisHandler {

    @Override
    public Statement analyze(StatementNode node, int scopeId, SemanticAnalyzer analyzer) {
        ReturnNode ret = (ReturnNode) node;
        Type expected = analyzer.currentReturnType();
        boolean bare = ret.value() instanceof NoExprNode;

        if (expected == Type.VOID) {
            if (!bare) {
                throw analyzer.error(CompilerErrorCode.RETURN_TYPE_MISMATCH,
                        "A VOID function cannot return a value.", ret.keyword());
            }
        } else if (bare) {
            throw analyzer.error(CompilerErrorCode.RETURN_TYPE_MISMATCH,
                    "RETURN needs a value of type " + expected + ".", ret.keyword());
        }

        TypedExpression value = analyzer.analyzeExpression(ret.value(), scopeId);
        if (!bare && !expected.equals(value.type())) {
            throw analyzer.error(CompilerErrorCode.RETURN_TYPE_MISMATCH,
                    "RETURN of " + value.type() + " in a function returning " + expected + ".", ret.keyword());
        }
        return new Statement.Return(value);
    }
}
