package org.syntaxscript.compiler.frontend.parser;

import org.syntaxscript.compiler.api.CodeAction;
import org.syntaxscript.compiler.api.CompilerErrorCode;
import org.syntaxscript.compiler.api.ParseException;
import org.syntaxscript.compiler.api.SourcePosition;
import org.syntaxscript.compiler.api.SourceRange;
import org.syntaxscript.compiler.dictionary.PrimitiveType;
import org.syntaxscript.compiler.frontend.lexer.Token;
import org.syntaxscript.compiler.frontend.lexer.TokenType;
import org.syntaxscript.compiler.frontend.parser.ast.BraceExpression;
import org.syntaxscript.compiler.frontend.parser.ast.Expression;
import org.syntaxscript.compiler.frontend.parser.ast.GlobalStatement;
import org.syntaxscript.compiler.frontend.parser.ast.IdentifierExpression;
import org.syntaxscript.compiler.frontend.parser.ast.KeywordStatement;
import org.syntaxscript.compiler.frontend.parser.ast.ParenExpression;
import org.syntaxscript.compiler.frontend.parser.ast.PrimitiveTypeExpression;
import org.syntaxscript.compiler.frontend.parser.ast.ProgramStatement;
import org.syntaxscript.compiler.frontend.parser.ast.SquareExpression;
import org.syntaxscript.compiler.frontend.parser.ast.Statement;
import org.syntaxscript.compiler.frontend.parser.ast.StringExpression;
import org.syntaxscript.compiler.frontend.parser.ast.VariableExpression;
import org.syntaxscript.compiler.frontend.parser.ast.WhitespaceIdentifierExpression;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The recursive-descent parser for Syntax Script. It consumes a list of tokens from the
 * {@link org.syntaxscript.compiler.frontend.lexer.Lexer} and produces a {@link ProgramStatement}.
 * <p>
 * Statements are dispatched by their introducing keyword through a {@link StatementHandlerRegistry};
 * the registry chosen by the {@link Grammar} decides which statements a file may contain. There is
 * no error recovery: the first violation aborts the parse with a {@link ParseException}.
 * A parser instance parses one token list once.
 */
public class Parser implements ParsingContext {

    /**
     * The two grammars sharing the expression sublanguage.
     */
    public enum Grammar {
        /** Declaration files ({@code .syx}). */
        DECLARATION,
        /** Usage files ({@code .sys}), limited to import statements. */
        USAGE
    }

    private final List<Token> tokens;
    private final String filePath;
    private final StatementHandlerRegistry handlerRegistry;
    private final List<Statement> statements = new ArrayList<>();
    private final Deque<List<Statement>> openBodies = new ArrayDeque<>();
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens   The list of tokens to parse, terminated by an end-of-file token.
     * @param filePath The path of the file, attached to errors and quick fixes.
     * @param grammar  The grammar to apply.
     */
    public Parser(List<Token> tokens, String filePath, Grammar grammar) {
        this.tokens = tokens;
        this.filePath = filePath;
        this.handlerRegistry = grammar == Grammar.DECLARATION
                ? StatementHandlerRegistry.forDeclarations()
                : StatementHandlerRegistry.forUsages();
    }

    /**
     * Parses the entire token stream.
     * @return The program containing all top-level statements.
     * @throws ParseException on the first grammar violation.
     */
    public ProgramStatement parse() throws ParseException {
        while (!isAtEnd()) {
            statements.add(parseStatement());
        }
        Token eof = tokens.get(tokens.size() - 1);
        return new ProgramStatement(statements, new SourceRange(new SourcePosition(0, 0), eof.range().end()));
    }

    @Override
    public Statement parseStatement() throws ParseException {
        Token token = peek();
        Optional<IStatementHandler> handler = handlerRegistry.get(token.type());
        if (handler.isEmpty()) {
            throw error(token.range(), CompilerErrorCode.UNEXPECTED_TOKEN, "Unexpected expression: '" + token.value() + "'.");
        }
        return handler.get().parse(this);
    }

    @Override
    public Expression parseExpression() throws ParseException {
        Token token = peek();
        switch (token.type()) {
            case SINGLE_QUOTE, DOUBLE_QUOTE -> {
                return string();
            }
            case OPEN_DIAMOND -> {
                return primitiveType();
            }
            case WHITESPACE_IDENTIFIER -> {
                return new WhitespaceIdentifierExpression(advance().range());
            }
            case OPEN_BRACE -> {
                Token open = advance();
                List<Statement> body = enclosed(TokenType.CLOSE_BRACE);
                return new BraceExpression(body, SourceRange.span(open.range(), advance().range()));
            }
            case OPEN_PAREN -> {
                Token open = advance();
                List<Statement> body = enclosed(TokenType.CLOSE_PAREN);
                return new ParenExpression(body, SourceRange.span(open.range(), advance().range()));
            }
            case OPEN_SQUARE -> {
                Token open = advance();
                List<Statement> body = enclosed(TokenType.CLOSE_SQUARE);
                return new SquareExpression(body, SourceRange.span(open.range(), advance().range()));
            }
            case IDENTIFIER -> {
                if (checkNext(TokenType.VAR_SEPARATOR)) return variable();
                Token identifier = advance();
                return new IdentifierExpression(identifier.value(), identifier.range());
            }
            default -> {
                if (handlerRegistry.get(token.type()).isPresent()) {
                    throw error(token.range(), CompilerErrorCode.STATEMENT_NOT_ALLOWED, "Unexpected statement.");
                }
                throw error(token.range(), CompilerErrorCode.UNEXPECTED_TOKEN, "Unexpected expression: '" + token.value() + "'.");
            }
        }
    }

    @Override
    public BraceExpression parseBlock(String owner) throws ParseException {
        if (!check(TokenType.OPEN_BRACE)) {
            throw error(peek().range(), CompilerErrorCode.UNEXPECTED_TOKEN,
                    "Expected braces after '" + owner + "', found '" + peek().value() + "'.");
        }
        return (BraceExpression) parseExpression();
    }

    private List<Statement> enclosed(TokenType close) throws ParseException {
        List<Statement> body = new ArrayList<>();
        openBodies.push(body);
        try {
            while (!check(close)) {
                body.add(parseStatement());
            }
        } finally {
            openBodies.pop();
        }
        return body;
    }

    private StringExpression string() throws ParseException {
        Token open = advance();
        StringBuilder value = new StringBuilder();
        Token last = open;
        while (!check(open.type())) {
            if (isAtEnd()) {
                throw error(SourceRange.span(open.range(), last.range()), CompilerErrorCode.UNTERMINATED_STRING, "Unterminated string.");
            }
            last = advance();
            value.append(last.value());
        }
        Token close = advance();
        return new StringExpression(value.toString(), SourceRange.span(open.range(), close.range()));
    }

    private PrimitiveTypeExpression primitiveType() throws ParseException {
        Token open = advance();
        Token name = consume(TokenType.IDENTIFIER, CompilerErrorCode.UNKNOWN_PRIMITIVE_TYPE,
                "Expected primitive type, found '" + peek().value() + "'.");
        if (PrimitiveType.fromName(name.value()).isEmpty()) {
            throw error(name.range(), CompilerErrorCode.UNKNOWN_PRIMITIVE_TYPE, "Expected primitive type, found '" + name.value() + "'.");
        }
        Token close = consume(TokenType.CLOSE_DIAMOND, CompilerErrorCode.UNEXPECTED_TOKEN,
                "Expected '>' after primitive type, found '" + peek().value() + "'.");
        return new PrimitiveTypeExpression(name.value(), SourceRange.span(open.range(), close.range()));
    }

    private VariableExpression variable() throws ParseException {
        Token name = advance();
        advance(); // consume '|'
        Token index = consume(TokenType.INT_NUMBER, CompilerErrorCode.UNEXPECTED_TOKEN,
                "Expected index after '" + name.value() + "' variable, found '" + peek().value() + "'.");
        int value;
        try {
            value = Integer.parseInt(index.value());
        } catch (NumberFormatException e) {
            throw error(index.range(), CompilerErrorCode.UNEXPECTED_TOKEN, "Invalid index '" + index.value() + "'.");
        }
        return new VariableExpression(name.value(), value, SourceRange.span(name.range(), index.range()));
    }

    @Override
    public List<String> declaredKeywords() {
        Set<String> words = new LinkedHashSet<>();
        collectKeywords(statements, words);
        Iterator<List<Statement>> outermostFirst = openBodies.descendingIterator();
        while (outermostFirst.hasNext()) {
            collectKeywords(outermostFirst.next(), words);
        }
        return List.copyOf(words);
    }

    private void collectKeywords(List<Statement> body, Set<String> words) {
        for (Statement statement : body) {
            if (statement instanceof KeywordStatement keyword) {
                words.add(keyword.word());
            } else if (statement instanceof GlobalStatement global) {
                collectKeywords(global.body(), words);
            }
        }
    }

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    /**
     * Checks the type of the next token without consuming it.
     * @param type The token type to check.
     * @return true if the next token is of the given type, false otherwise.
     */
    public boolean checkNext(TokenType type) {
        if (isAtEnd() || current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
    }

    @Override
    public Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    @Override
    public Token peek() {
        return tokens.get(current);
    }

    @Override
    public Token previous() {
        return tokens.get(Math.max(0, current - 1));
    }

    @Override
    public Token consume(TokenType type, CompilerErrorCode code, String message) throws ParseException {
        if (check(type)) return advance();
        throw error(peek().range(), code, message);
    }

    @Override
    public Token consumeSemicolon() throws ParseException {
        return consume(TokenType.SEMICOLON, CompilerErrorCode.MISSING_SEMICOLON,
                "Expected ';' after statement, found '" + peek().value() + "'.");
    }

    @Override
    public String filePath() {
        return filePath;
    }

    @Override
    public ParseException error(SourceRange range, CompilerErrorCode code, String message, List<CodeAction> actions) {
        return new ParseException(code, message, range, filePath, actions);
    }
}
