package org.syntaxscript.compiler.frontend.parser.ast;

import org.syntaxscript.compiler.api.SourceRange;

/**
 * The {@code +s} whitespace identifier.
 *
 * @param range The range of the token.
 */
public record WhitespaceIdentifierExpression(SourceRange range) implements Expression {

    /** The source text of a whitespace identifier. */
    public static final String TEXT = "+s";

    @Override
    public String value() {
        return TEXT;
    }

    @Override
    public NodeType type() {
        return NodeType.WHITESPACE_IDENTIFIER;
    }
}
