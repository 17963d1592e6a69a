package org.syntaxscript.compiler.frontend.parser.ast;

import org.syntaxscript.compiler.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.List;

final class Modifiers {

    private Modifiers() {}

    static List<Token> prepend(Token modifier, List<Token> modifiers) {
        List<Token> result = new ArrayList<>(modifiers.size() + 1);
        result.add(modifier);
        result.addAll(modifiers);
        return List.copyOf(result);
    }
}
