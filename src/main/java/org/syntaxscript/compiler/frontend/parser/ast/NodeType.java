package org.syntaxscript.compiler.frontend.parser.ast;

/**
 * Tags every node of the abstract syntax tree with its kind.
 */
public enum NodeType {
    PROGRAM,

    // Statements
    OPERATOR,
    COMPILE,
    IMPORT,
    IMPORTS,
    FUNCTION,
    GLOBAL,
    KEYWORD,
    RULE,

    // Expressions
    PRIMITIVE_TYPE,
    WHITESPACE_IDENTIFIER,
    VARIABLE,
    STRING,
    IDENTIFIER,
    BRACE,
    PAREN,
    SQUARE
}
