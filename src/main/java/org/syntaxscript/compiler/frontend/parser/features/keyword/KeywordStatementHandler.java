package org.syntaxscript.compiler.frontend.parser.features.keyword;

import org.syntaxscript.compiler.api.CompilerErrorCode;
import org.syntaxscript.compiler.api.ParseException;
import org.syntaxscript.compiler.api.SourceRange;
import org.syntaxscript.compiler.frontend.lexer.Token;
import org.syntaxscript.compiler.frontend.lexer.TokenType;
import org.syntaxscript.compiler.frontend.parser.IStatementHandler;
import org.syntaxscript.compiler.frontend.parser.ParsingContext;
import org.syntaxscript.compiler.frontend.parser.ast.KeywordStatement;
import org.syntaxscript.compiler.frontend.parser.ast.Statement;

import java.util.List;

/**
 * Handles the parsing of the {@code keyword} statement.
 */
public class KeywordStatementHandler implements IStatementHandler {

    /**
     * Parses {@code keyword word;}.
     * @param context The parsing context.
     * @return A {@link KeywordStatement}.
     * @throws ParseException if the word is missing or the statement is not terminated.
     */
    @Override
    public Statement parse(ParsingContext context) throws ParseException {
        Token keyword = context.advance(); // consume 'keyword'
        Token word = context.consume(TokenType.IDENTIFIER, CompilerErrorCode.UNEXPECTED_TOKEN,
                "Expected identifier after keyword statement, found '" + context.peek().value() + "'.");
        context.consumeSemicolon();
        return new KeywordStatement(word.value(), SourceRange.span(keyword.range(), word.range()), List.of());
    }
}
