package org.syntaxscript.compiler.frontend.parser.features.global;

import org.syntaxscript.compiler.api.CompilerErrorCode;
import org.syntaxscript.compiler.api.ParseException;
import org.syntaxscript.compiler.api.SourceRange;
import org.syntaxscript.compiler.frontend.lexer.Token;
import org.syntaxscript.compiler.frontend.lexer.TokenType;
import org.syntaxscript.compiler.frontend.parser.IStatementHandler;
import org.syntaxscript.compiler.frontend.parser.ParsingContext;
import org.syntaxscript.compiler.frontend.parser.ast.BraceExpression;
import org.syntaxscript.compiler.frontend.parser.ast.GlobalStatement;
import org.syntaxscript.compiler.frontend.parser.ast.ImportStatement;
import org.syntaxscript.compiler.frontend.parser.ast.Statement;

import java.util.List;

/**
 * Handles the parsing of the {@code global} statement, a named group of declarations.
 * Imports are only allowed at the top level of a file.
 */
public class GlobalStatementHandler implements IStatementHandler {

    @Override
    public Statement parse(ParsingContext context) throws ParseException {
        Token keyword = context.advance(); // consume 'global'
        Token name = context.consume(TokenType.IDENTIFIER, CompilerErrorCode.UNEXPECTED_TOKEN,
                "Expected identifier after global statement, found '" + context.peek().value() + "'.");

        BraceExpression body = context.parseBlock("global");
        for (Statement member : body.body()) {
            if (member instanceof ImportStatement) {
                throw context.error(member.range(), CompilerErrorCode.STATEMENT_NOT_ALLOWED, "Statement not allowed.");
            }
        }
        return new GlobalStatement(name.value(), body.body(), SourceRange.span(keyword.range(), body.range()), List.of());
    }
}
