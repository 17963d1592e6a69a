package org.syntaxscript.compiler.frontend.parser.features.importing;

import org.syntaxscript.compiler.api.CompilerErrorCode;
import org.syntaxscript.compiler.api.ParseException;
import org.syntaxscript.compiler.api.SourceRange;
import org.syntaxscript.compiler.frontend.lexer.Token;
import org.syntaxscript.compiler.frontend.parser.IStatementHandler;
import org.syntaxscript.compiler.frontend.parser.ParsingContext;
import org.syntaxscript.compiler.frontend.parser.ast.Expression;
import org.syntaxscript.compiler.frontend.parser.ast.ImportStatement;
import org.syntaxscript.compiler.frontend.parser.ast.Statement;
import org.syntaxscript.compiler.frontend.parser.ast.StringExpression;

import java.util.List;

/**
 * Handles the parsing of the {@code import} statement, the only statement a usage file knows.
 */
public class ImportStatementHandler implements IStatementHandler {

    /**
     * Parses {@code import 'path';}. The path is kept as written; resolution happens in the checks and the compiler.
     * @param context The parsing context.
     * @return An {@link ImportStatement}.
     * @throws ParseException if the path is not a string or the semicolon is missing.
     */
    @Override
    public Statement parse(ParsingContext context) throws ParseException {
        Token keyword = context.advance(); // consume 'import'
        Expression path = context.parseExpression();
        if (!(path instanceof StringExpression string)) {
            throw context.error(path.range(), CompilerErrorCode.UNEXPECTED_TOKEN,
                    "Expected string after import statement, found '" + path.value() + "'.");
        }
        context.consumeSemicolon();
        return new ImportStatement(string.value(), SourceRange.span(keyword.range(), string.range()), List.of());
    }
}
