package org.automatic.compiler.frontend.lexer;

import org.automatic.compiler.api.CompilerErrorCode;
import org.automatic.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The Lexer (also known as Tokenizer or Scanner) converts the characters of one source unit
 * into tokens. It works on demand: the preprocessor pulls tokens one at a time and can tell
 * the lexer to jump over a conditionally excluded region without tokenizing it.
 * <p>
 * Layout is kept: whitespace and line-ends are tokens of their own.
 */
public class Lexer {

    private static final Map<String, TokenType> DIRECTIVES = Map.of(
            "INCLUDE", TokenType.INCLUDE,
            "DEFINE", TokenType.DEFINE,
            "UNDEF", TokenType.UNDEF,
            "IFDEF", TokenType.IFDEF,
            "IFNDEF", TokenType.IFNDEF,
            "END", TokenType.END
    );

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final String logicalFileName;
    private int start = 0;
    private int startColumn = 1;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the unit being lexed, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * @return The logical name of the unit this lexer reads.
     */
    public String getLogicalFileName() {
        return logicalFileName;
    }

    /**
     * Tokenizes the whole unit, including directives, without preprocessing.
     * @return The tokens, ending with {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.END_OF_FILE);
        return tokens;
    }

    /**
     * Scans the next token. Once the end is reached every call returns an end-of-file token.
     * @return The next token.
     */
    public Token nextToken() {
        start = current;
        startColumn = column;
        if (isAtEnd()) {
            return new Token(TokenType.END_OF_FILE, "", null, line, column, logicalFileName);
        }
        char c = advance();
        switch (c) {
            case '"':
                return string();
            case '#':
                return directive();
            case '\n': {
                Token newline = makeToken(TokenType.NEWLINE, null);
                line++;
                column = 1;
                return newline;
            }
            case ' ', '\t', '\r':
                while (peek() == ' ' || peek() == '\t' || peek() == '\r') advance();
                return makeToken(TokenType.WHITESPACE, null);
            case '/':
                if (peek() == '/') {
                    // A comment goes until the end of the line.
                    while (peek() != '\n' && !isAtEnd()) advance();
                    return makeToken(TokenType.WHITESPACE, null);
                }
                return makeToken(TokenType.CHAR, null);
            default:
                if (isDigit(c)) return number();
                if (isIdentifierStart(c)) return identifier();
                return makeToken(TokenType.CHAR, null);
        }
    }

    /**
     * Skips the raw text of a region excluded by a false conditional, up to and including the
     * {@code #END} that closes it. Nested {@code #IFDEF}/{@code #IFNDEF} are counted; nothing
     * else in the region is looked at, so it does not have to be well-formed.
     *
     * @return {@code true} if the closing {@code #END} was found, {@code false} if the unit ended first.
     */
    public boolean skipExcludedRegion() {
        int depth = 1;
        while (!isAtEnd()) {
            char c = advance();
            if (c == '\n') {
                line++;
                column = 1;
                continue;
            }
            if (c != '#') continue;
            while (peek() == ' ' || peek() == '\t') advance();
            int wordStart = current;
            while (isUpper(peek())) advance();
            String word = source.substring(wordStart, current);
            if (word.equals("IFDEF") || word.equals("IFNDEF")) {
                depth++;
            } else if (word.equals("END") && --depth == 0) {
                return true;
            }
        }
        return false;
    }

    private Token directive() {
        while (peek() == ' ' || peek() == '\t') advance();
        int wordStart = current;
        while (isUpper(peek())) advance();
        String word = source.substring(wordStart, current);
        TokenType type = DIRECTIVES.get(word);
        if (type == null) {
            throw diagnostics.abort(CompilerErrorCode.MALFORMED_DIRECTIVE,
                    "Unknown directive '#" + word + "'.", logicalFileName, line);
        }
        return makeToken(type, word);
    }

    private Token identifier() {
        while (isIdentifierPart(peek())) advance();
        return makeToken(TokenType.IDENTIFIER, null);
    }

    private Token number() {
        while (isDigit(peek())) advance();
        String digits = source.substring(start, current);
        Integer value;
        try {
            value = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            // Out of range: the parser reports it if the digits are used as an integer literal.
            value = null;
        }
        return makeToken(TokenType.INTEGER, value);
    }

    private Token string() {
        while (peek() != '"' && peek() != '\n' && !isAtEnd()) advance();
        if (peek() != '"') {
            throw diagnostics.abort(CompilerErrorCode.UNTERMINATED_STRING,
                    "Unterminated string.", logicalFileName, line);
        }
        advance(); // The closing "
        return makeToken(TokenType.STRING, source.substring(start + 1, current - 1));
    }

    private Token makeToken(TokenType type, Object value) {
        return new Token(type, source.substring(start, current), value, line, startColumn, logicalFileName);
    }

    private char advance() {
        column++;
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isUpper(char c) {
        return c >= 'A' && c <= 'Z';
    }

    private static boolean isIdentifierStart(char c) {
        return isUpper(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
