package org.syntaxscript.compiler.frontend.parser.ast;

import org.syntaxscript.compiler.api.SourceRange;
import org.syntaxscript.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * {@code imports(ts, js) 'module';}: a module the generated code needs for the listed formats.
 *
 * @param formats   The target formats.
 * @param module    The module name.
 * @param range     The range from the keyword to the closing quote of the module.
 * @param modifiers The modifier tokens.
 */
public record ImportsStatement(List<String> formats, String module, SourceRange range, List<Token> modifiers) implements Statement {

    public ImportsStatement {
        formats = List.copyOf(formats);
        modifiers = List.copyOf(modifiers);
    }

    @Override
    public NodeType type() {
        return NodeType.IMPORTS;
    }

    @Override
    public ImportsStatement withModifier(Token modifier) {
        return new ImportsStatement(formats, module, SourceRange.span(modifier.range(), range), Modifiers.prepend(modifier, modifiers));
    }
}
