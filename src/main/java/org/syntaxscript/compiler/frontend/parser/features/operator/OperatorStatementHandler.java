package org.syntaxscript.compiler.frontend.parser.features.operator;

import org.syntaxscript.compiler.api.CompilerErrorCode;
import org.syntaxscript.compiler.api.ParseException;
import org.syntaxscript.compiler.api.SourceRange;
import org.syntaxscript.compiler.frontend.lexer.Token;
import org.syntaxscript.compiler.frontend.lexer.TokenType;
import org.syntaxscript.compiler.frontend.parser.IStatementHandler;
import org.syntaxscript.compiler.frontend.parser.ParsingContext;
import org.syntaxscript.compiler.frontend.parser.ast.BraceExpression;
import org.syntaxscript.compiler.frontend.parser.ast.Expression;
import org.syntaxscript.compiler.frontend.parser.ast.OperatorStatement;
import org.syntaxscript.compiler.frontend.parser.ast.PrimitiveTypeExpression;
import org.syntaxscript.compiler.frontend.parser.ast.Statement;
import org.syntaxscript.compiler.frontend.parser.ast.StringExpression;
import org.syntaxscript.compiler.frontend.parser.ast.WhitespaceIdentifierExpression;
import org.syntaxscript.compiler.frontend.parser.features.compile.ClauseBodies;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles the parsing of the {@code operator} statement.
 */
public class OperatorStatementHandler implements IStatementHandler {

    /**
     * Parses {@code operator <fragment>... { clauses }}. Fragments are {@code <type>} placeholders,
     * {@code +s} and strings; the body holds compile and imports statements.
     * @param context The parsing context.
     * @return An {@link OperatorStatement}.
     * @throws ParseException if the pattern is empty or holds another expression, or the body is invalid.
     */
    @Override
    public Statement parse(ParsingContext context) throws ParseException {
        Token keyword = context.advance(); // consume 'operator'

        List<Expression> fragments = new ArrayList<>();
        while (!context.check(TokenType.OPEN_BRACE)) {
            Expression fragment = context.parseExpression();
            if (!(fragment instanceof PrimitiveTypeExpression || fragment instanceof WhitespaceIdentifierExpression || fragment instanceof StringExpression)) {
                throw context.error(fragment.range(), CompilerErrorCode.UNEXPECTED_TOKEN,
                        "Unexpected expression in operator pattern: '" + fragment.value() + "'.");
            }
            fragments.add(fragment);
        }
        if (fragments.isEmpty()) {
            throw context.error(context.peek().range(), CompilerErrorCode.UNEXPECTED_TOKEN, "Expected operator pattern after 'operator'.");
        }

        BraceExpression body = context.parseBlock("operator");
        ClauseBodies.requireClausesOnly(context, body.body());
        return new OperatorStatement(fragments, body.body(), SourceRange.span(keyword.range(), body.range()), List.of());
    }
}
