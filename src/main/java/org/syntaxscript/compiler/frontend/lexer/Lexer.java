package org.syntaxscript.compiler.frontend.lexer;

import org.syntaxscript.compiler.api.SourceRange;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The Lexer converts Syntax Script source text into a flat sequence of tokens.
 * <p>
 * The lexer never fails. It tracks whether it is inside a string literal; there every
 * character that would otherwise form a structural token is emitted as {@link TokenType#RAW}
 * so any text can appear in strings. A lexer instance scans one source once.
 */
public class Lexer {

    /** The marker that ends the import section of a usage file. */
    public static final String DEFINITION_END = ":::";

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "operator", TokenType.OPERATOR_KEYWORD,
            "compile", TokenType.COMPILE_KEYWORD,
            "import", TokenType.IMPORT_KEYWORD,
            "imports", TokenType.IMPORTS_KEYWORD,
            "export", TokenType.EXPORT_KEYWORD,
            "global", TokenType.GLOBAL_KEYWORD,
            "class", TokenType.CLASS_KEYWORD,
            "function", TokenType.FUNCTION_KEYWORD,
            "keyword", TokenType.KEYWORD_KEYWORD,
            "rule", TokenType.RULE_KEYWORD
    );

    private final String source;
    private final LexerMode mode;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startColumn = 1;
    private char openQuote = 0;

    /**
     * Creates a new Lexer for a declaration file.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this(source, LexerMode.DECLARATION);
    }

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param mode   The kind of file being scanned.
     */
    public Lexer(String source, LexerMode mode) {
        this.source = source;
        this.mode = mode;
    }

    /**
     * Performs the tokenization of the source code.
     * @return The recognized tokens, always terminated by an {@link TokenType#END_OF_FILE} token.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            if (mode == LexerMode.USAGE && source.startsWith(DEFINITION_END, current)) break;
            start = current;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "EOF", SourceRange.of(line, column, column)));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '\'', '"' -> quote(c);
            case '(' -> addStructural(TokenType.OPEN_PAREN);
            case ')' -> addStructural(TokenType.CLOSE_PAREN);
            case '{' -> addStructural(TokenType.OPEN_BRACE);
            case '}' -> addStructural(TokenType.CLOSE_BRACE);
            case '[' -> addStructural(TokenType.OPEN_SQUARE);
            case ']' -> addStructural(TokenType.CLOSE_SQUARE);
            case ',' -> addStructural(TokenType.COMMA);
            case ';' -> addStructural(TokenType.SEMICOLON);
            case '<' -> addStructural(TokenType.OPEN_DIAMOND);
            case '>' -> addStructural(TokenType.CLOSE_DIAMOND);
            case '|' -> addStructural(TokenType.VAR_SEPARATOR);
            case '/' -> {
                if (!inString() && peek() == '/') {
                    // A comment goes until the end of the line.
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else {
                    addToken(TokenType.RAW);
                }
            }
            case '+' -> {
                if (peek() == 's') {
                    advance();
                    addStructural(TokenType.WHITESPACE_IDENTIFIER);
                } else {
                    addToken(TokenType.RAW);
                }
            }
            case '\n' -> {
                if (inString()) addToken(TokenType.RAW);
                line++;
                column = 1;
            }
            case ' ', '\r', '\t' -> {
                if (inString()) addToken(TokenType.RAW);
            }
            default -> {
                if (isDigit(c)) {
                    while (isDigit(peek())) advance();
                    addStructural(TokenType.INT_NUMBER);
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    addToken(TokenType.RAW);
                }
            }
        }
    }

    private void quote(char c) {
        addToken(c == '\'' ? TokenType.SINGLE_QUOTE : TokenType.DOUBLE_QUOTE);
        if (!inString()) {
            openQuote = c;
        } else if (openQuote == c) {
            openQuote = 0;
        }
    }

    private void identifier() {
        while (isAlpha(peek())) advance();
        String text = source.substring(start, current);
        addStructural(KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER));
    }

    private void addStructural(TokenType type) {
        addToken(inString() ? TokenType.RAW : type);
    }

    private void addToken(TokenType type) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, SourceRange.of(line, startColumn, startColumn + text.length())));
    }

    private boolean inString() {
        return openQuote != 0;
    }

    private char advance() {
        column++;
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
