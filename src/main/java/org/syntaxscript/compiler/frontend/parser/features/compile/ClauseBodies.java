package org.syntaxscript.compiler.frontend.parser.features.compile;

import org.syntaxscript.compiler.api.CompilerErrorCode;
import org.syntaxscript.compiler.api.ParseException;
import org.syntaxscript.compiler.frontend.parser.ParsingContext;
import org.syntaxscript.compiler.frontend.parser.ast.CompileStatement;
import org.syntaxscript.compiler.frontend.parser.ast.ImportsStatement;
import org.syntaxscript.compiler.frontend.parser.ast.Statement;

import java.util.List;

/**
 * Validation shared by the bodies of operators and functions, which may only hold
 * {@code compile} and {@code imports} clauses.
 */
public final class ClauseBodies {

    private ClauseBodies() {}

    /**
     * @param context The parsing context.
     * @param body    The parsed body.
     * @throws ParseException on the first statement that is neither a compile nor an imports statement.
     */
    public static void requireClausesOnly(ParsingContext context, List<Statement> body) throws ParseException {
        for (Statement statement : body) {
            if (!(statement instanceof CompileStatement) && !(statement instanceof ImportsStatement)) {
                throw context.error(statement.range(), CompilerErrorCode.STATEMENT_NOT_ALLOWED, "Statement not allowed.");
            }
        }
    }
}
