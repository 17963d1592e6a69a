package org.syntaxscript.compiler.frontend.parser.ast;

import org.syntaxscript.compiler.api.SourceRange;

/**
 * A bare identifier, as in the word of a keyword statement or a keyword rule value.
 *
 * @param value The identifier.
 * @param range The range of the identifier.
 */
public record IdentifierExpression(String value, SourceRange range) implements Expression {
    @Override
    public NodeType type() {
        return NodeType.IDENTIFIER;
    }
}
