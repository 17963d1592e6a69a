package org.syntaxscript.compiler.frontend.parser.ast;

import org.syntaxscript.compiler.api.SourceRange;
import org.syntaxscript.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A custom operator: a pattern made of fragments and a body of compile and imports statements.
 *
 * @param regex     The pattern fragments: primitive types, whitespace identifiers and strings.
 * @param body      The compile and imports statements.
 * @param range     The range from the keyword to the closing brace.
 * @param modifiers The modifier tokens.
 */
public record OperatorStatement(List<Expression> regex, List<Statement> body, SourceRange range, List<Token> modifiers) implements Statement {

    public OperatorStatement {
        regex = List.copyOf(regex);
        body = List.copyOf(body);
        modifiers = List.copyOf(modifiers);
    }

    /**
     * @return The range from the first to the last pattern fragment.
     */
    public SourceRange patternRange() {
        return SourceRange.span(regex.get(0).range(), regex.get(regex.size() - 1).range());
    }

    @Override
    public NodeType type() {
        return NodeType.OPERATOR;
    }

    @Override
    public OperatorStatement withModifier(Token modifier) {
        return new OperatorStatement(regex, body, SourceRange.span(modifier.range(), range), Modifiers.prepend(modifier, modifiers));
    }
}
