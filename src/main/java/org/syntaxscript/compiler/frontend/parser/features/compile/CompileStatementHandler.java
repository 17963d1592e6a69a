package org.syntaxscript.compiler.frontend.parser.features.compile;

import org.syntaxscript.compiler.api.CompilerErrorCode;
import org.syntaxscript.compiler.api.ParseException;
import org.syntaxscript.compiler.api.SourceRange;
import org.syntaxscript.compiler.frontend.lexer.Token;
import org.syntaxscript.compiler.frontend.lexer.TokenType;
import org.syntaxscript.compiler.frontend.parser.IStatementHandler;
import org.syntaxscript.compiler.frontend.parser.ParsingContext;
import org.syntaxscript.compiler.frontend.parser.ast.CompileStatement;
import org.syntaxscript.compiler.frontend.parser.ast.Expression;
import org.syntaxscript.compiler.frontend.parser.ast.Statement;
import org.syntaxscript.compiler.frontend.parser.ast.StringExpression;
import org.syntaxscript.compiler.frontend.parser.ast.VariableExpression;
import org.syntaxscript.compiler.frontend.parser.ast.WhitespaceIdentifierExpression;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles the parsing of the {@code compile} statement.
 */
public class CompileStatementHandler implements IStatementHandler {

    /**
     * Parses {@code compile(fmt, ...) part part ...;} where every template part is a string,
     * a {@code +s} or a {@code name|index} capture reference.
     * @param context The parsing context.
     * @return A {@link CompileStatement}.
     * @throws ParseException if the format list or a template part is malformed.
     */
    @Override
    public Statement parse(ParsingContext context) throws ParseException {
        Token keyword = context.advance(); // consume 'compile'
        TargetFormats formats = TargetFormats.parse(context, "compile");

        List<Expression> template = new ArrayList<>();
        SourceRange end = formats.closeParen().range();
        while (!context.check(TokenType.SEMICOLON) && !context.isAtEnd()) {
            Expression part = context.parseExpression();
            if (!(part instanceof StringExpression || part instanceof WhitespaceIdentifierExpression || part instanceof VariableExpression)) {
                throw context.error(part.range(), CompilerErrorCode.UNEXPECTED_TOKEN,
                        "Unexpected expression in compile template: '" + part.value() + "'.");
            }
            template.add(part);
            end = part.range();
        }
        context.consumeSemicolon();
        return new CompileStatement(formats.formats(), template, SourceRange.span(keyword.range(), end), List.of());
    }
}
