package org.syntaxscript.compiler.frontend.lexer;

import org.syntaxscript.compiler.api.SourceRange;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type  The type of the token.
 * @param value The exact text of the token from the source code.
 * @param range The 1-based range the token occupies.
 */
public record Token(
        TokenType type,
        String value,
        SourceRange range
) {
}
