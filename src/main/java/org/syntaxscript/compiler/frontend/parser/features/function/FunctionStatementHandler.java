package org.syntaxscript.compiler.frontend.parser.features.function;

import org.syntaxscript.compiler.api.CompilerErrorCode;
import org.syntaxscript.compiler.api.ParseException;
import org.syntaxscript.compiler.api.SourceRange;
import org.syntaxscript.compiler.frontend.lexer.Token;
import org.syntaxscript.compiler.frontend.lexer.TokenType;
import org.syntaxscript.compiler.frontend.parser.IStatementHandler;
import org.syntaxscript.compiler.frontend.parser.ParsingContext;
import org.syntaxscript.compiler.frontend.parser.ast.BraceExpression;
import org.syntaxscript.compiler.frontend.parser.ast.Expression;
import org.syntaxscript.compiler.frontend.parser.ast.FunctionStatement;
import org.syntaxscript.compiler.frontend.parser.ast.PrimitiveTypeExpression;
import org.syntaxscript.compiler.frontend.parser.ast.Statement;
import org.syntaxscript.compiler.frontend.parser.features.compile.ClauseBodies;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles the parsing of the {@code function} statement.
 */
public class FunctionStatementHandler implements IStatementHandler {

    /**
     * Parses {@code function name <type>... { clauses }}.
     * @param context The parsing context.
     * @return A {@link FunctionStatement}.
     * @throws ParseException if the name is missing, an argument is not a primitive type, or the body is invalid.
     */
    @Override
    public Statement parse(ParsingContext context) throws ParseException {
        Token keyword = context.advance(); // consume 'function'
        Token name = context.consume(TokenType.IDENTIFIER, CompilerErrorCode.UNEXPECTED_TOKEN,
                "Expected identifier after function statement, found '" + context.peek().value() + "'.");

        List<String> arguments = new ArrayList<>();
        while (!context.check(TokenType.OPEN_BRACE)) {
            Expression argument = context.parseExpression();
            if (!(argument instanceof PrimitiveTypeExpression type)) {
                throw context.error(argument.range(), CompilerErrorCode.UNEXPECTED_TOKEN,
                        "Expected argument types after function name, found '" + argument.value() + "'.");
            }
            arguments.add(type.value());
        }

        BraceExpression body = context.parseBlock("function");
        ClauseBodies.requireClausesOnly(context, body.body());
        return new FunctionStatement(name.value(), arguments, body.body(), SourceRange.span(keyword.range(), body.range()), List.of());
    }
}
