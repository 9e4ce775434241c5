package org.automatic.compiler.frontend.semantics.analysis;

import org.automatic.compiler.api.CompilerErrorCode;
import org.automatic.compiler.frontend.parser.ast.StatementNode;
import org.automatic.compiler.frontend.parser.ast.VarDeclNode;
import org.automatic.compiler.frontend.semantics.SemanticAnalyzer;
import org.automatic.compiler.frontend.semantics.tree.Statement;
import org.automatic.compiler.frontend.semantics.tree.TypedExpression;
import org.automatic.compiler.types.Type;

/**
 * Handles local variable declarations and resolves AUTO from the initializer.
 * The initializer is checked before the name is declared, so it sees an outer variable of the same name.
 */
public class VarDeclAnalysisHandler implements IAnalysisHandler {

    @Override
    public Statement analyze(StatementNode node, int scopeId, SemanticAnalyzer analyzer) {
        VarDeclNode decl = (VarDeclNode) node;
        String name = decl.name().text();
        TypedExpression initializer = decl.initializer() == null
                ? null
                : analyzer.analyzeExpression(decl.initializer(), scopeId);

        Type type;
        if (decl.type().type() == Type.AUTO) {
            if (initializer == null) {
                throw analyzer.error(CompilerErrorCode.AUTO_WITHOUT_INITIALIZER,
                        "AUTO variable '" + name + "' needs an initializer.", decl.name());
            }
            if (!initializer.type().isStorable()) {
                throw analyzer.error(CompilerErrorCode.INVALID_DECLARATION_TYPE,
                        "AUTO variable '" + name + "' cannot be initialised from a " + initializer.type() + " value.",
                        decl.name());
            }
            type = initializer.type();
        } else {
            type = analyzer.checkStorageType(decl.type(), "Variable '" + name + "'");
            if (initializer != null) {
                analyzer.checkAssignable(type, initializer, decl.name(),
                        "Cannot initialise '" + name + "' of type " + type + " with " + initializer.type() + ".");
            }
        }

        analyzer.declareVariable(scopeId, decl.name(), type);
        return new Statement.VarDecl(type, name, initializer);
    }
}
