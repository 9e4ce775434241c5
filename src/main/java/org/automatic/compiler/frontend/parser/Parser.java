package org.automatic.compiler.frontend.parser;

import org.automatic.compiler.api.CompilerErrorCode;
import org.automatic.compiler.diagnostics.CompilerAbortException;
import org.automatic.compiler.diagnostics.DiagnosticsEngine;
import org.automatic.compiler.frontend.lexer.Token;
import org.automatic.compiler.frontend.lexer.TokenType;
import org.automatic.compiler.frontend.parser.ast.*;
import org.automatic.compiler.types.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The parser for the language. It consumes the token stream produced by the
 * {@link org.automatic.compiler.frontend.preprocessor.PreProcessor} and produces an Abstract Syntax Tree (AST).
 * <p>
 * The token stream keeps whitespace and line-ends. The parser skips them explicitly, but still
 * looks at raw adjacency to assemble multi-character operators ({@code == != <= >= && ||}) and
 * float literals ({@code 1.5}) from their single-character and integer tokens.
 * <p>
 * The first syntax error aborts parsing; there is no recovery.
 */
public class Parser {

    private static final Map<String, Type> TYPE_KEYWORDS = Map.of(
            "INT", Type.INT,
            "FLOAT", Type.FLOAT,
            "BOOL", Type.BOOL,
            "VOID", Type.VOID,
            "STRING", Type.STRING,
            "AUTO", Type.AUTO
    );

    private static final Set<String> RESERVED_WORDS = Set.of(
            "INT", "FLOAT", "BOOL", "VOID", "STRING", "AUTO", "MATRIX",
            "IF", "ELSE", "WHILE", "FOR", "RETURN", "TRUE", "FALSE"
    );

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private int current = 0;
    private Token previousOperator;

    /**
     * Constructs a new Parser.
     * @param tokens The token stream, ending with {@link TokenType#END_OF_FILE}.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses the entire token stream.
     * @return The program.
     * @throws CompilerAbortException on the first syntax error.
     */
    public ProgramNode parse() {
        List<AstNode> declarations = new ArrayList<>();
        while (!isAtEnd()) {
            declarations.add(topLevelDeclaration());
        }
        return new ProgramNode(declarations);
    }

    private AstNode topLevelDeclaration() {
        TypeNode type = type();
        Token name = identifier("a global or function name");
        if (matchChar('(')) {
            return function(type, name);
        }
        expectChar(';', "';' after global declaration");
        return new GlobalVariableNode(type, name);
    }

    private FunctionNode function(TypeNode returnType, Token name) {
        List<ParameterNode> parameters = new ArrayList<>();
        if (!checkChar(')')) {
            do {
                TypeNode type = type();
                parameters.add(new ParameterNode(type, identifier("a parameter name")));
            } while (matchChar(','));
        }
        expectChar(')', "')' after parameters");
        expectChar('{', "'{' before function body");
        List<StatementNode> body = statementsUntilClosingBrace();
        return new FunctionNode(returnType, name, parameters, body);
    }

    // --- Types ---

    private boolean checkType() {
        Token token = peek();
        return token.type() == TokenType.IDENTIFIER
                && (TYPE_KEYWORDS.containsKey(token.text()) || token.text().equals("MATRIX"));
    }

    private TypeNode type() {
        Token token = peek();
        if (token.type() == TokenType.IDENTIFIER) {
            Type primitive = TYPE_KEYWORDS.get(token.text());
            if (primitive != null) {
                advance();
                return new TypeNode(token, primitive);
            }
            if (token.text().equals("MATRIX")) {
                advance();
                expectChar('<', "'<' after MATRIX");
                TypeNode element = type();
                expectChar(',', "',' after matrix element type");
                int rows = dimension();
                expectChar(',', "',' after matrix rows");
                int cols = dimension();
                expectChar('>', "'>' after matrix columns");
                return new TypeNode(token, new Type.Matrix(element.type(), rows, cols));
            }
        }
        throw unexpected(token, "a type");
    }

    private int dimension() {
        Token token = peek();
        if (token.type() != TokenType.INTEGER) {
            throw unexpected(token, "a matrix dimension");
        }
        advance();
        return integerValue(token);
    }

    // --- Statements ---

    private List<StatementNode> statementsUntilClosingBrace() {
        List<StatementNode> statements = new ArrayList<>();
        while (!checkChar('}')) {
            if (isAtEnd()) {
                throw unexpected(peek(), "'}'");
            }
            statements.add(statement());
        }
        advance(); // consume }
        return statements;
    }

    private StatementNode statement() {
        Token token = peek();
        if (token.isChar('{')) {
            advance();
            return new BlockNode(token, statementsUntilClosingBrace());
        }
        if (token.isChar(';')) {
            advance();
            return new ExpressionStatementNode(new NoExprNode(token));
        }
        if (checkType()) {
            return variableDeclaration();
        }
        if (checkKeyword("RETURN")) return returnStatement();
        if (checkKeyword("IF")) return ifStatement();
        if (checkKeyword("WHILE")) return whileStatement();
        if (checkKeyword("FOR")) return forStatement();

        ExpressionNode expression = expression();
        expectChar(';', "';' after expression");
        return new ExpressionStatementNode(expression);
    }

    private VarDeclNode variableDeclaration() {
        TypeNode type = type();
        Token name = identifier("a variable name");
        ExpressionNode initializer = null;
        if (checkAssignOperator()) {
            advance();
            initializer = expression();
        }
        expectChar(';', "';' after variable declaration");
        return new VarDeclNode(type, name, initializer);
    }

    private ReturnNode returnStatement() {
        Token keyword = advance();
        ExpressionNode value = checkChar(';') ? new NoExprNode(keyword) : expression();
        expectChar(';', "';' after RETURN");
        return new ReturnNode(keyword, value);
    }

    private IfNode ifStatement() {
        Token keyword = advance();
        expectChar('(', "'(' after IF");
        ExpressionNode condition = expression();
        expectChar(')', "')' after IF condition");
        StatementNode thenBranch = statement();
        StatementNode elseBranch = null;
        if (checkKeyword("ELSE")) {
            advance();
            elseBranch = statement();
        }
        return new IfNode(keyword, condition, thenBranch, elseBranch);
    }

    private WhileNode whileStatement() {
        Token keyword = advance();
        expectChar('(', "'(' after WHILE");
        ExpressionNode condition = expression();
        expectChar(')', "')' after WHILE condition");
        return new WhileNode(keyword, condition, statement());
    }

    private ForNode forStatement() {
        Token keyword = advance();
        expectChar('(', "'(' after FOR");
        ExpressionNode init = checkChar(';') ? new NoExprNode(peek()) : expression();
        expectChar(';', "';' after FOR initializer");
        ExpressionNode condition = checkChar(';') ? new BoolLiteralNode(peek(), true) : expression();
        expectChar(';', "';' after FOR condition");
        ExpressionNode update = checkChar(')') ? new NoExprNode(peek()) : expression();
        expectChar(')', "')' after FOR clauses");
        return new ForNode(keyword, init, condition, update, statement());
    }

    // --- Expressions ---

    /**
     * Parses an expression, including assignments.
     * @return The expression node.
     */
    public ExpressionNode expression() {
        Token token = peek();
        if (token.type() == TokenType.IDENTIFIER && !RESERVED_WORDS.contains(token.text())) {
            int next = significantIndex(current + 1);
            if (isAssignOperatorAt(next)) {
                advance(); // identifier
                advance(); // =
                return new AssignNode(token, expression());
            }
        }
        return or();
    }

    private ExpressionNode or() {
        ExpressionNode left = and();
        while (checkOperator("||")) {
            Token op = consumeOperator("||");
            left = new BinaryOpNode(left, op, BinaryOperator.OR, and());
        }
        return left;
    }

    private ExpressionNode and() {
        ExpressionNode left = equality();
        while (checkOperator("&&")) {
            Token op = consumeOperator("&&");
            left = new BinaryOpNode(left, op, BinaryOperator.AND, equality());
        }
        return left;
    }

    private ExpressionNode equality() {
        ExpressionNode left = relational();
        while (true) {
            BinaryOperator operator = matchOperator(BinaryOperator.EQ, BinaryOperator.NE);
            if (operator == null) return left;
            left = new BinaryOpNode(left, previousOperator, operator, relational());
        }
    }

    private ExpressionNode relational() {
        ExpressionNode left = additive();
        while (true) {
            // Two-character forms first so that '<=' is not read as '<'.
            BinaryOperator operator = matchOperator(BinaryOperator.LE, BinaryOperator.GE, BinaryOperator.LT, BinaryOperator.GT);
            if (operator == null) return left;
            left = new BinaryOpNode(left, previousOperator, operator, additive());
        }
    }

    private ExpressionNode additive() {
        ExpressionNode left = term();
        while (true) {
            BinaryOperator operator = matchOperator(BinaryOperator.ADD, BinaryOperator.SUB);
            if (operator == null) return left;
            left = new BinaryOpNode(left, previousOperator, operator, term());
        }
    }

    private ExpressionNode term() {
        ExpressionNode left = unary();
        while (true) {
            BinaryOperator operator = matchOperator(BinaryOperator.MUL, BinaryOperator.DIV);
            if (operator == null) return left;
            left = new BinaryOpNode(left, previousOperator, operator, unary());
        }
    }

    private ExpressionNode unary() {
        Token token = peek();
        if (token.isChar('-')) {
            advance();
            return new UnaryOpNode(token, UnaryOperator.NEG, unary());
        }
        if (token.isChar('!') && !checkOperator("!=")) {
            advance();
            return new UnaryOpNode(token, UnaryOperator.NOT, unary());
        }
        return primary();
    }

    private ExpressionNode primary() {
        Token token = peek();
        switch (token.type()) {
            case INTEGER:
                advance();
                if (isCharAt(current, '.') && current + 1 < tokens.size()
                        && tokens.get(current + 1).type() == TokenType.INTEGER) {
                    advance(); // .
                    Token fraction = advance();
                    return new FloatLiteralNode(token, Double.parseDouble(token.text() + "." + fraction.text()));
                }
                return new IntegerLiteralNode(token, integerValue(token));
            case STRING:
                advance();
                return new StringLiteralNode(token, (String) token.value());
            case IDENTIFIER:
                return identifierExpression(token);
            case CHAR:
                if (token.isChar('(')) {
                    advance();
                    ExpressionNode inner = expression();
                    expectChar(')', "')' after expression");
                    return inner;
                }
                if (token.isChar('[')) {
                    return matrixLiteral();
                }
                break;
            default:
                break;
        }
        throw unexpected(token, "an expression");
    }

    private ExpressionNode identifierExpression(Token token) {
        switch (token.text()) {
            case "TRUE":
                advance();
                return new BoolLiteralNode(token, true);
            case "FALSE":
                advance();
                return new BoolLiteralNode(token, false);
            default:
                break;
        }
        if (RESERVED_WORDS.contains(token.text())) {
            throw unexpected(token, "an expression");
        }
        advance();
        if (matchChar('(')) {
            List<ExpressionNode> arguments = new ArrayList<>();
            if (!checkChar(')')) {
                do {
                    arguments.add(expression());
                } while (matchChar(','));
            }
            expectChar(')', "')' after arguments");
            return new CallNode(token, arguments);
        }
        return new IdentifierNode(token);
    }

    private MatrixLiteralNode matrixLiteral() {
        Token open = advance();
        List<List<ExpressionNode>> rows = new ArrayList<>();
        do {
            expectChar('[', "'[' to start a matrix row");
            List<ExpressionNode> row = new ArrayList<>();
            do {
                row.add(expression());
            } while (matchChar(','));
            expectChar(']', "']' after matrix row");
            rows.add(row);
        } while (matchChar(','));
        expectChar(']', "']' after matrix literal");
        return new MatrixLiteralNode(open, rows);
    }

    // --- Token helpers ---

    private BinaryOperator matchOperator(BinaryOperator... candidates) {
        for (BinaryOperator candidate : candidates) {
            if (checkOperator(candidate.symbol())) {
                previousOperator = consumeOperator(candidate.symbol());
                return candidate;
            }
        }
        return null;
    }

    /**
     * Checks for an operator spelled by adjacent single-character tokens.
     * A one-character operator does not match if it is the start of a two-character one.
     */
    private boolean checkOperator(String symbol) {
        skipLayout();
        for (int i = 0; i < symbol.length(); i++) {
            if (!isCharAt(current + i, symbol.charAt(i))) return false;
        }
        if (symbol.length() == 1) {
            char c = symbol.charAt(0);
            if ((c == '<' || c == '>' || c == '=' || c == '!') && isCharAt(current + 1, '=')) return false;
        }
        return true;
    }

    private Token consumeOperator(String symbol) {
        Token first = peek();
        current += symbol.length();
        return first;
    }

    private boolean checkAssignOperator() {
        skipLayout();
        return isAssignOperatorAt(current);
    }

    private boolean isAssignOperatorAt(int index) {
        return isCharAt(index, '=') && !isCharAt(index + 1, '=');
    }

    private boolean isCharAt(int index, char c) {
        return index < tokens.size() && tokens.get(index).isChar(c);
    }

    private int significantIndex(int from) {
        int index = from;
        while (index < tokens.size() && tokens.get(index).isLayout()) index++;
        return index;
    }

    private void skipLayout() {
        current = significantIndex(current);
    }

    private boolean checkKeyword(String keyword) {
        Token token = peek();
        return token.type() == TokenType.IDENTIFIER && token.text().equals(keyword);
    }

    private boolean checkChar(char c) {
        return peek().isChar(c);
    }

    private boolean matchChar(char c) {
        if (checkChar(c)) {
            advance();
            return true;
        }
        return false;
    }

    private void expectChar(char c, String what) {
        if (!matchChar(c)) {
            throw unexpected(peek(), what);
        }
    }

    private Token identifier(String what) {
        Token token = peek();
        if (token.type() != TokenType.IDENTIFIER || RESERVED_WORDS.contains(token.text())) {
            throw unexpected(token, what);
        }
        return advance();
    }

    private int integerValue(Token token) {
        if (token.value() == null) {
            throw diagnostics.abort(CompilerErrorCode.INTEGER_LITERAL_OUT_OF_RANGE,
                    "Integer literal '" + token.text() + "' does not fit in 32 bits.", token.fileName(), token.line());
        }
        return (Integer) token.value();
    }

    private Token peek() {
        skipLayout();
        return tokens.get(current);
    }

    private Token advance() {
        Token token = peek();
        if (!isAtEnd()) current++;
        return token;
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private CompilerAbortException unexpected(Token token, String expected) {
        if (token.type() == TokenType.END_OF_FILE) {
            return diagnostics.abort(CompilerErrorCode.UNEXPECTED_END_OF_INPUT,
                    "Expected " + expected + " but reached the end of input.", token.fileName(), token.line());
        }
        return diagnostics.abort(CompilerErrorCode.UNEXPECTED_TOKEN,
                "Expected " + expected + " but found '" + token.text() + "'.", token.fileName(), token.line());
    }
}
