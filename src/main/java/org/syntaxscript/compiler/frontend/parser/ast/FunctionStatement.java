package org.syntaxscript.compiler.frontend.parser.ast;

import org.syntaxscript.compiler.api.SourceRange;
import org.syntaxscript.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A function declaration: a name, its argument types and a body of compile and imports statements.
 *
 * @param name      The function name.
 * @param arguments The primitive type names of the arguments, in order.
 * @param body      The compile and imports statements.
 * @param range     The range from the keyword to the closing brace.
 * @param modifiers The modifier tokens.
 */
public record FunctionStatement(String name, List<String> arguments, List<Statement> body, SourceRange range, List<Token> modifiers) implements Statement {

    public FunctionStatement {
        arguments = List.copyOf(arguments);
        body = List.copyOf(body);
        modifiers = List.copyOf(modifiers);
    }

    @Override
    public NodeType type() {
        return NodeType.FUNCTION;
    }

    @Override
    public FunctionStatement withModifier(Token modifier) {
        return new FunctionStatement(name, arguments, body, SourceRange.span(modifier.range(), range), Modifiers.prepend(modifier, modifiers));
    }
}
