package org.syntaxscript.compiler.frontend.parser.ast;

/**
 * An expression node. Expressions never appear at the top level of a program; they form
 * operator patterns, compile templates, argument lists and statement bodies.
 */
public sealed interface Expression extends AstNode permits
        PrimitiveTypeExpression, WhitespaceIdentifierExpression, VariableExpression, StringExpression,
        IdentifierExpression, BraceExpression, ParenExpression, SquareExpression {

    /**
     * @return The textual value of the expression.
     */
    String value();
}
