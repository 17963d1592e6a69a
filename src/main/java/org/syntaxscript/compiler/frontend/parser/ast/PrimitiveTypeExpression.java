package org.syntaxscript.compiler.frontend.parser.ast;

import org.syntaxscript.compiler.api.SourceRange;

/**
 * A {@code <type>} placeholder.
 *
 * @param value The primitive type name, one of int, string, boolean or decimal.
 * @param range The range from {@code <} to {@code >}.
 */
public record PrimitiveTypeExpression(String value, SourceRange range) implements Expression {
    @Override
    public NodeType type() {
        return NodeType.PRIMITIVE_TYPE;
    }
}
