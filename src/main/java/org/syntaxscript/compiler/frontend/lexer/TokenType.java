package org.syntaxscript.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 * Characters that fit no other type become {@link #RAW}, which lets strings contain anything.
 */
public enum TokenType {
    // Single-character tokens.
    /** {@code {} */
    OPEN_BRACE,
    /** {@code }} */
    CLOSE_BRACE,
    /** {@code ;} */
    SEMICOLON,
    /** {@code ,} */
    COMMA,
    /** {@code (} */
    OPEN_PAREN,
    /** {@code )} */
    CLOSE_PAREN,
    /** {@code [} */
    OPEN_SQUARE,
    /** {@code ]} */
    CLOSE_SQUARE,
    /** {@code <} */
    OPEN_DIAMOND,
    /** {@code >} */
    CLOSE_DIAMOND,
    /** {@code '} */
    SINGLE_QUOTE,
    /** {@code "} */
    DOUBLE_QUOTE,
    /** {@code |}, separating a capture name from its index. */
    VAR_SEPARATOR,

    // Keywords.
    /** {@code operator} */
    OPERATOR_KEYWORD,
    /** {@code compile} */
    COMPILE_KEYWORD,
    /** {@code import} */
    IMPORT_KEYWORD,
    /** {@code imports} */
    IMPORTS_KEYWORD,
    /** {@code export} */
    EXPORT_KEYWORD,
    /** {@code global} */
    GLOBAL_KEYWORD,
    /** {@code class}, reserved. */
    CLASS_KEYWORD,
    /** {@code function} */
    FUNCTION_KEYWORD,
    /** {@code keyword} */
    KEYWORD_KEYWORD,
    /** {@code rule} */
    RULE_KEYWORD,

    // Literals.
    /** An alphabetic word that is not a keyword. */
    IDENTIFIER,
    /** A run of digits without fractional part. */
    INT_NUMBER,
    /** {@code +s}, any amount of whitespace. */
    WHITESPACE_IDENTIFIER,

    // Miscellaneous.
    /** {@code :::}, the end of the import section of a usage file. Never emitted, the usage lexer stops before it. */
    DEFINITION_END,
    /** Anything else, and every structural character inside a string. */
    RAW,
    /** Represents the end of the source file. */
    END_OF_FILE
}
