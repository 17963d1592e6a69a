package org.syntaxscript.compiler.frontend.parser.ast;

import org.syntaxscript.compiler.api.SourceRange;
import org.syntaxscript.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A named group of declarations.
 *
 * @param name      The global name.
 * @param body      The member statements.
 * @param range     The range from the keyword to the closing brace.
 * @param modifiers The modifier tokens.
 */
public record GlobalStatement(String name, List<Statement> body, SourceRange range, List<Token> modifiers) implements Statement {

    public GlobalStatement {
        body = List.copyOf(body);
        modifiers = List.copyOf(modifiers);
    }

    @Override
    public NodeType type() {
        return NodeType.GLOBAL;
    }

    @Override
    public GlobalStatement withModifier(Token modifier) {
        return new GlobalStatement(name, body, SourceRange.span(modifier.range(), range), Modifiers.prepend(modifier, modifiers));
    }
}
