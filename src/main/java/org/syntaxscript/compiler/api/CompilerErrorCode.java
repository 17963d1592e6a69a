package org.syntaxscript.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can abort parsing or compilation.
 * This decouples the test logic from the wording of error messages.
 */
public enum CompilerErrorCode {
    // region Parser Errors
    /** A token appeared where the grammar does not allow it. */
    UNEXPECTED_TOKEN,
    /** A statement was not terminated by a semicolon. */
    MISSING_SEMICOLON,
    /** A string literal reached the end of the file before its closing quote. */
    UNTERMINATED_STRING,
    /** A {@code <type>} placeholder named something other than a primitive type. */
    UNKNOWN_PRIMITIVE_TYPE,
    /** A rule statement referenced a rule that is not in the dictionary. */
    UNKNOWN_RULE,
    /** A rule value does not match the value kind of the rule. */
    INVALID_RULE_VALUE,
    /** A keyword rule referenced a keyword that was not declared. */
    UNKNOWN_KEYWORD,
    /** An export modifier was followed by a statement that cannot be exported. */
    NOT_EXPORTABLE,
    /** A statement appeared inside a body that does not allow it. */
    STATEMENT_NOT_ALLOWED,
    /** A target format list in a compile or imports statement is malformed. */
    INVALID_FORMAT_LIST,
    // endregion

    // region Compiler Errors
    /** A usage file imported a declaration file that was not compiled before. */
    UNRESOLVED_IMPORT,
    /** Two imported operators share the same compiled pattern. */
    DUPLICATE_OPERATOR_IMPORT,
    /** A descriptor has no output for the configured target format. */
    MISSING_TARGET_FORMAT,
    /** The same target format was declared twice for one operator or function. */
    DUPLICATE_TARGET_FORMAT,
    /** A template referenced a capture the operator pattern does not have. */
    UNKNOWN_CAPTURE,
    /** A function compile statement does not start with the replacement name. */
    INVALID_FUNCTION_TEMPLATE,
    // endregion

    // region General Errors
    /** An I/O error occurred while reading or writing a file. */
    IO_ERROR
    // endregion
}
