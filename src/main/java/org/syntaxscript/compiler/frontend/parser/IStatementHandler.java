package org.syntaxscript.compiler.frontend.parser;

import org.syntaxscript.compiler.api.ParseException;
import org.syntaxscript.compiler.frontend.parser.ast.Statement;

/**
 * The base interface for all statement handlers.
 * Each handler parses the statement introduced by one keyword (e.g. {@code operator}).
 */
public interface IStatementHandler {

    /**
     * Parses the statement. The current token of the context is the introducing keyword.
     *
     * @param context The context that provides access to the token stream.
     * @return The parsed statement.
     * @throws ParseException on the first grammar violation.
     */
    Statement parse(ParsingContext context) throws ParseException;
}
