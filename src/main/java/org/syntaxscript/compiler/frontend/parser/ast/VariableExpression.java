package org.syntaxscript.compiler.frontend.parser.ast;

import org.syntaxscript.compiler.api.SourceRange;

/**
 * A {@code name|index} capture reference inside a compile template.
 *
 * @param value The capture name, the primitive type whose placeholder is referenced.
 * @param index The 0-based index among the placeholders of that type.
 * @param range The range from the name to the index.
 */
public record VariableExpression(String value, int index, SourceRange range) implements Expression {
    @Override
    public NodeType type() {
        return NodeType.VARIABLE;
    }
}
