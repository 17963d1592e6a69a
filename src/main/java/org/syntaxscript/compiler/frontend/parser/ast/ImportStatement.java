package org.syntaxscript.compiler.frontend.parser.ast;

import org.syntaxscript.compiler.api.SourceRange;
import org.syntaxscript.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * {@code import 'path';} in a declaration or usage file.
 *
 * @param path      The path as written, without quotes.
 * @param range     The range from the keyword to the closing quote.
 * @param modifiers The modifier tokens.
 */
public record ImportStatement(String path, SourceRange range, List<Token> modifiers) implements Statement {

    public ImportStatement {
        modifiers = List.copyOf(modifiers);
    }

    @Override
    public NodeType type() {
        return NodeType.IMPORT;
    }

    @Override
    public ImportStatement withModifier(Token modifier) {
        return new ImportStatement(path, SourceRange.span(modifier.range(), range), Modifiers.prepend(modifier, modifiers));
    }
}
