package org.syntaxscript.compiler.frontend.parser.ast;

import org.syntaxscript.compiler.api.SourceRange;
import org.syntaxscript.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * {@code keyword word;}
 *
 * @param word      The declared word.
 * @param range     The range from the keyword to the word.
 * @param modifiers The modifier tokens.
 */
public record KeywordStatement(String word, SourceRange range, List<Token> modifiers) implements Statement {

    public KeywordStatement {
        modifiers = List.copyOf(modifiers);
    }

    @Override
    public NodeType type() {
        return NodeType.KEYWORD;
    }

    @Override
    public KeywordStatement withModifier(Token modifier) {
        return new KeywordStatement(word, SourceRange.span(modifier.range(), range), Modifiers.prepend(modifier, modifiers));
    }
}
