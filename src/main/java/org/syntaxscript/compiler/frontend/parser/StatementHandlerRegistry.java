package org.syntaxscript.compiler.frontend.parser;

import org.syntaxscript.compiler.frontend.lexer.TokenType;
import org.syntaxscript.compiler.frontend.parser.features.compile.CompileStatementHandler;
import org.syntaxscript.compiler.frontend.parser.features.compile.ImportsStatementHandler;
import org.syntaxscript.compiler.frontend.parser.features.export.ExportStatementHandler;
import org.syntaxscript.compiler.frontend.parser.features.function.FunctionStatementHandler;
import org.syntaxscript.compiler.frontend.parser.features.global.GlobalStatementHandler;
import org.syntaxscript.compiler.frontend.parser.features.importing.ImportStatementHandler;
import org.syntaxscript.compiler.frontend.parser.features.keyword.KeywordStatementHandler;
import org.syntaxscript.compiler.frontend.parser.features.operator.OperatorStatementHandler;
import org.syntaxscript.compiler.frontend.parser.features.rule.RuleStatementHandler;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry for statement handlers. This class holds a map of introducing keyword tokens
 * to their corresponding handlers and so defines which statements a grammar accepts.
 */
public class StatementHandlerRegistry {
    private final Map<TokenType, IStatementHandler> handlers = new EnumMap<>(TokenType.class);

    /**
     * Registers a new statement handler.
     * @param keyword The keyword token type introducing the statement.
     * @param handler The handler for the statement.
     */
    public void register(TokenType keyword, IStatementHandler handler) {
        handlers.put(keyword, handler);
    }

    /**
     * Gets the handler for a given keyword.
     * @param keyword The keyword token type.
     * @return An {@link Optional} containing the handler if it exists, otherwise empty.
     */
    public Optional<IStatementHandler> get(TokenType keyword) {
        return Optional.ofNullable(handlers.get(keyword));
    }

    /**
     * Initializes a registry with the full declaration file grammar.
     * @return A new registry with all statement handlers registered.
     */
    public static StatementHandlerRegistry forDeclarations() {
        StatementHandlerRegistry registry = forUsages();
        registry.register(TokenType.OPERATOR_KEYWORD, new OperatorStatementHandler());
        registry.register(TokenType.COMPILE_KEYWORD, new CompileStatementHandler());
        registry.register(TokenType.IMPORTS_KEYWORD, new ImportsStatementHandler());
        registry.register(TokenType.FUNCTION_KEYWORD, new FunctionStatementHandler());
        registry.register(TokenType.KEYWORD_KEYWORD, new KeywordStatementHandler());
        registry.register(TokenType.RULE_KEYWORD, new RuleStatementHandler());
        registry.register(TokenType.GLOBAL_KEYWORD, new GlobalStatementHandler());
        registry.register(TokenType.EXPORT_KEYWORD, new ExportStatementHandler());
        return registry;
    }

    /**
     * Initializes a registry with the usage file grammar, which only knows import statements.
     * @return A new registry with the import handler registered.
     */
    public static StatementHandlerRegistry forUsages() {
        StatementHandlerRegistry registry = new StatementHandlerRegistry();
        registry.register(TokenType.IMPORT_KEYWORD, new ImportStatementHandler());
        return registry;
    }
}
