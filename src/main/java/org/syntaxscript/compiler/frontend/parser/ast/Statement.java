package org.syntaxscript.compiler.frontend.parser.ast;

import org.syntaxscript.compiler.frontend.lexer.Token;
import org.syntaxscript.compiler.frontend.lexer.TokenType;

import java.util.List;
import java.util.Optional;

/**
 * A statement of a declaration or usage file.
 * <p>
 * Every statement carries the modifier tokens written in front of it, currently only {@code export}.
 */
public sealed interface Statement extends AstNode permits
        ImportStatement, OperatorStatement, CompileStatement, ImportsStatement,
        FunctionStatement, KeywordStatement, RuleStatement, GlobalStatement {

    /**
     * @return The modifier tokens in source order.
     */
    List<Token> modifiers();

    /**
     * Returns a copy of this statement with the given modifier prepended. The range of the copy
     * starts at the modifier.
     * @param modifier The modifier token.
     * @return The modified statement.
     */
    Statement withModifier(Token modifier);

    /**
     * @return The {@code export} modifier, if present.
     */
    default Optional<Token> exportModifier() {
        return modifiers().stream().filter(t -> t.type() == TokenType.EXPORT_KEYWORD).findFirst();
    }

    /**
     * @return {@code true} if the statement carries an {@code export} modifier.
     */
    default boolean isExported() {
        return exportModifier().isPresent();
    }
}
