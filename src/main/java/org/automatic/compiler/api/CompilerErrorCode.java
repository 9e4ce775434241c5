package org.automatic.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during compilation.
 * This decouples the test logic from the error messages.
 */
public enum CompilerErrorCode {
    // region Lexer & Preprocessor Errors
    /** A string literal was not closed before the end of its line. */
    UNTERMINATED_STRING(ErrorKind.LEXICAL),
    /** A '#' was not followed by a known directive keyword, or the directive arguments are malformed. */
    MALFORMED_DIRECTIVE(ErrorKind.LEXICAL),
    /** The target of an #INCLUDE could not be found. */
    UNRESOLVED_INCLUDE(ErrorKind.LEXICAL),
    /** Includes are nested deeper than the configured limit. */
    INCLUDE_DEPTH_EXCEEDED(ErrorKind.LEXICAL),
    /** An #END without an open conditional, or a unit ending inside one. */
    UNBALANCED_CONDITIONAL(ErrorKind.LEXICAL),
    /** An integer literal does not fit into a signed 32-bit integer. */
    INTEGER_LITERAL_OUT_OF_RANGE(ErrorKind.LEXICAL),
    /** An I/O error occurred while reading a unit. */
    IO_ERROR_READING_FILE(ErrorKind.LEXICAL),
    // endregion

    // region Parser Errors
    /** A token that the grammar does not allow at this position. */
    UNEXPECTED_TOKEN(ErrorKind.SYNTAX),
    /** The input ended in the middle of a construct. */
    UNEXPECTED_END_OF_INPUT(ErrorKind.SYNTAX),
    // endregion

    // region Semantic Analysis Errors
    /** An identifier was used that no enclosing scope declares. */
    UNDECLARED_IDENTIFIER(ErrorKind.SEMANTIC),
    /** A call to a function that does not exist. */
    UNDECLARED_FUNCTION(ErrorKind.SEMANTIC),
    /** A name declared twice in the same scope or namespace. */
    DUPLICATE_DECLARATION(ErrorKind.SEMANTIC),
    /** A call with the wrong number of arguments. */
    ARITY_MISMATCH(ErrorKind.SEMANTIC),
    /** A value whose type does not match what its context requires. */
    TYPE_MISMATCH(ErrorKind.SEMANTIC),
    /** An operator applied to operand types it does not support. */
    INVALID_OPERAND_TYPES(ErrorKind.SEMANTIC),
    /** An AUTO declaration without an initializer to infer from. */
    AUTO_WITHOUT_INITIALIZER(ErrorKind.SEMANTIC),
    /** AUTO or VOID used where a concrete value type is needed. */
    INVALID_DECLARATION_TYPE(ErrorKind.SEMANTIC),
    /** A return statement that does not match the function's return type. */
    RETURN_TYPE_MISMATCH(ErrorKind.SEMANTIC),
    /** A malformed matrix literal or matrix type. */
    MATRIX_SHAPE_MISMATCH(ErrorKind.SEMANTIC),
    // endregion

    // region Internal Errors
    /** The code generator met a construct the analyzer should have rejected. */
    INTERNAL_ERROR(ErrorKind.INTERNAL);
    // endregion

    private final ErrorKind kind;

    CompilerErrorCode(ErrorKind kind) {
        this.kind = kind;
    }

    /**
     * @return The stage this error belongs to.
     */
    public ErrorKind kind() {
        return kind;
    }
}
