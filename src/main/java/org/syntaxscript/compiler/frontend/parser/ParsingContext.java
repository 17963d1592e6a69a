package org.syntaxscript.compiler.frontend.parser;

import org.syntaxscript.compiler.api.CodeAction;
import org.syntaxscript.compiler.api.CompilerErrorCode;
import org.syntaxscript.compiler.api.ParseException;
import org.syntaxscript.compiler.api.SourceRange;
import org.syntaxscript.compiler.frontend.lexer.Token;
import org.syntaxscript.compiler.frontend.lexer.TokenType;
import org.syntaxscript.compiler.frontend.parser.ast.BraceExpression;
import org.syntaxscript.compiler.frontend.parser.ast.Expression;
import org.syntaxscript.compiler.frontend.parser.ast.Statement;

import java.util.List;

/**
 * An interface that encapsulates the state of a single parse.
 * It provides statement handlers with access to the token stream and the shared productions
 * without coupling them directly to the parser.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Returns the previously consumed token.
     * @return The previous token.
     */
    Token previous();

    /**
     * Checks if the parser has reached the end of the token stream.
     * @return true if at the end, false otherwise.
     */
    boolean isAtEnd();

    /**
     * Consumes the current token if it is of the expected type, otherwise fails.
     * @param type    The expected token type.
     * @param code    The error code used on failure.
     * @param message The error message used on failure.
     * @return The consumed token.
     * @throws ParseException if the current token is of another type.
     */
    Token consume(TokenType type, CompilerErrorCode code, String message) throws ParseException;

    /**
     * Consumes the semicolon terminating a statement.
     * @return The semicolon token.
     * @throws ParseException if the current token is not a semicolon.
     */
    Token consumeSemicolon() throws ParseException;

    /**
     * Parses the next statement through the registered statement handlers.
     * @return The parsed statement.
     * @throws ParseException on the first grammar violation.
     */
    Statement parseStatement() throws ParseException;

    /**
     * Parses the next expression.
     * @return The parsed expression.
     * @throws ParseException on the first grammar violation.
     */
    Expression parseExpression() throws ParseException;

    /**
     * Parses a brace-enclosed body of statements.
     * @param owner The keyword owning the body, used in the error message.
     * @return The parsed body.
     * @throws ParseException if the current token does not open a brace body, or the body is malformed.
     */
    BraceExpression parseBlock(String owner) throws ParseException;

    /**
     * Collects the words of all keyword statements parsed so far, including members of globals
     * and of bodies that are still open.
     * @return The declared words in declaration order.
     */
    List<String> declaredKeywords();

    /**
     * @return The path of the file being parsed, exactly as handed to the parser.
     */
    String filePath();

    /**
     * Creates a parse error located in the current file.
     * @param range   The offending range.
     * @param code    The error code.
     * @param message The error message.
     * @param actions Quick fixes for the error, best first.
     * @return The exception, ready to be thrown.
     */
    ParseException error(SourceRange range, CompilerErrorCode code, String message, List<CodeAction> actions);

    /**
     * Creates a parse error without quick fixes.
     * @param range   The offending range.
     * @param code    The error code.
     * @param message The error message.
     * @return The exception, ready to be thrown.
     */
    default ParseException error(SourceRange range, CompilerErrorCode code, String message) {
        return error(range, code, message, List.of());
    }
}
