package org.syntaxscript.compiler.frontend.parser.ast;

import org.syntaxscript.compiler.api.SourceRange;

/**
 * A quoted string literal.
 *
 * @param value The contents between the quotes.
 * @param range The range from the opening to the closing quote.
 */
public record StringExpression(String value, SourceRange range) implements Expression {
    @Override
    public NodeType type() {
        return NodeType.STRING;
    }
}
