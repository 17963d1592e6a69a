package org.syntaxscript.compiler.frontend.parser.ast;

import org.syntaxscript.compiler.api.SourceRange;
import org.syntaxscript.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * {@code compile(ts, js) <template>;} inside an operator or function body.
 *
 * @param formats   The target formats the template applies to.
 * @param body      The template parts: strings, whitespace identifiers and variables.
 * @param range     The range from the keyword to the last template part.
 * @param modifiers The modifier tokens.
 */
public record CompileStatement(List<String> formats, List<Expression> body, SourceRange range, List<Token> modifiers) implements Statement {

    public CompileStatement {
        formats = List.copyOf(formats);
        body = List.copyOf(body);
        modifiers = List.copyOf(modifiers);
    }

    @Override
    public NodeType type() {
        return NodeType.COMPILE;
    }

    @Override
    public CompileStatement withModifier(Token modifier) {
        return new CompileStatement(formats, body, SourceRange.span(modifier.range(), range), Modifiers.prepend(modifier, modifiers));
    }
}
