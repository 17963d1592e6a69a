package org.syntaxscript.compiler.frontend.parser.ast;

import org.syntaxscript.compiler.api.SourceRange;

import java.util.List;

/**
 * Statements enclosed in {@code [ ]}.
 *
 * @param body  The enclosed statements.
 * @param range The range from the opening to the closing bracket.
 */
public record SquareExpression(List<Statement> body, SourceRange range) implements Expression {

    public SquareExpression {
        body = List.copyOf(body);
    }

    @Override
    public String value() {
        return "[";
    }

    @Override
    public NodeType type() {
        return NodeType.SQUARE;
    }
}
