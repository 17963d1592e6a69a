package org.syntaxscript.compiler.frontend.parser.features.compile;

import org.syntaxscript.compiler.api.CompilerErrorCode;
import org.syntaxscript.compiler.api.ParseException;
import org.syntaxscript.compiler.api.SourceRange;
import org.syntaxscript.compiler.frontend.lexer.Token;
import org.syntaxscript.compiler.frontend.parser.IStatementHandler;
import org.syntaxscript.compiler.frontend.parser.ParsingContext;
import org.syntaxscript.compiler.frontend.parser.ast.Expression;
import org.syntaxscript.compiler.frontend.parser.ast.ImportsStatement;
import org.syntaxscript.compiler.frontend.parser.ast.Statement;
import org.syntaxscript.compiler.frontend.parser.ast.StringExpression;

import java.util.List;

/**
 * Handles the parsing of the {@code imports} statement.
 */
public class ImportsStatementHandler implements IStatementHandler {

    /**
     * Parses {@code imports(fmt, ...) 'module';}.
     * @param context The parsing context.
     * @return An {@link ImportsStatement}.
     * @throws ParseException if the format list is malformed, the module is not a string or the semicolon is missing.
     */
    @Override
    public Statement parse(ParsingContext context) throws ParseException {
        Token keyword = context.advance(); // consume 'imports'
        TargetFormats formats = TargetFormats.parse(context, "imports");

        Expression module = context.parseExpression();
        if (!(module instanceof StringExpression string)) {
            throw context.error(module.range(), CompilerErrorCode.UNEXPECTED_TOKEN,
                    "Expected string after parens of imports statement, found '" + module.value() + "'.");
        }
        context.consumeSemicolon();
        return new ImportsStatement(formats.formats(), string.value(), SourceRange.span(keyword.range(), string.range()), List.of());
    }
}
