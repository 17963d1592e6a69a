package org.syntaxscript.compiler.frontend.parser.features.compile;

import org.syntaxscript.compiler.api.CompilerErrorCode;
import org.syntaxscript.compiler.api.ParseException;
import org.syntaxscript.compiler.frontend.lexer.Token;
import org.syntaxscript.compiler.frontend.lexer.TokenType;
import org.syntaxscript.compiler.frontend.parser.ParsingContext;

import java.util.ArrayList;
import java.util.List;

/**
 * The parenthesized target format list of {@code compile} and {@code imports} statements, e.g. {@code (ts, js)}.
 *
 * @param formats    The target formats in source order.
 * @param closeParen The closing parenthesis.
 */
public record TargetFormats(List<String> formats, Token closeParen) {

    public TargetFormats {
        formats = List.copyOf(formats);
    }

    /**
     * Parses a non-empty, comma-separated list of identifiers in parentheses.
     * @param context The parsing context, positioned at the opening parenthesis.
     * @param owner   The statement keyword, used in error messages.
     * @return The parsed list.
     * @throws ParseException if the list is missing or malformed.
     */
    public static TargetFormats parse(ParsingContext context, String owner) throws ParseException {
        context.consume(TokenType.OPEN_PAREN, CompilerErrorCode.INVALID_FORMAT_LIST,
                "Expected parens after '" + owner + "' statement, found '" + context.peek().value() + "'.");
        List<String> formats = new ArrayList<>();
        do {
            Token format = context.consume(TokenType.IDENTIFIER, CompilerErrorCode.INVALID_FORMAT_LIST,
                    "Expected target format, found '" + context.peek().value() + "'.");
            formats.add(format.value());
        } while (context.match(TokenType.COMMA));
        Token close = context.consume(TokenType.CLOSE_PAREN, CompilerErrorCode.INVALID_FORMAT_LIST,
                "Expected ',' or ')' in target format list, found '" + context.peek().value() + "'.");
        return new TargetFormats(formats, close);
    }
}
