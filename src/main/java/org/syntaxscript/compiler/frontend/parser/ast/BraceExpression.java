package org.syntaxscript.compiler.frontend.parser.ast;

import org.syntaxscript.compiler.api.SourceRange;

import java.util.List;

/**
 * A block of statements in braces, the body of operators, functions and globals.
 *
 * @param body  The enclosed statements.
 * @param range The range from the opening to the closing brace.
 */
public record BraceExpression(List<Statement> body, SourceRange range) implements Expression {

    public BraceExpression {
        body = List.copyOf(body);
    }

    @Override
    public String value() {
        return "{";
    }

    @Override
    public NodeType type() {
        return NodeType.BRACE;
    }
}
