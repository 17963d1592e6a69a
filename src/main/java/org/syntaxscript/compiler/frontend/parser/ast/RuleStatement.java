package org.syntaxscript.compiler.frontend.parser.ast;

import org.syntaxscript.compiler.api.SourceRange;
import org.syntaxscript.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * {@code rule 'name': value;}
 *
 * @param rule      The rule name.
 * @param value     The value as written.
 * @param range     The range from the keyword to the value.
 * @param modifiers The modifier tokens.
 */
public record RuleStatement(String rule, String value, SourceRange range, List<Token> modifiers) implements Statement {

    public RuleStatement {
        modifiers = List.copyOf(modifiers);
    }

    @Override
    public NodeType type() {
        return NodeType.RULE;
    }

    @Override
    public RuleStatement withModifier(Token modifier) {
        return new RuleStatement(rule, value, SourceRange.span(modifier.range(), range), Modifiers.prepend(modifier, modifiers));
    }
}
