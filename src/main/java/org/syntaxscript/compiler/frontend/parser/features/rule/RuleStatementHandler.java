package org.syntaxscript.compiler.frontend.parser.features.rule;

import org.syntaxscript.compiler.api.CodeAction;
import org.syntaxscript.compiler.api.CompilerErrorCode;
import org.syntaxscript.compiler.api.ParseException;
import org.syntaxscript.compiler.api.SourceRange;
import org.syntaxscript.compiler.api.TextEdit;
import org.syntaxscript.compiler.dictionary.Dictionary;
import org.syntaxscript.compiler.dictionary.RuleDefinition;
import org.syntaxscript.compiler.dictionary.RuleValueType;
import org.syntaxscript.compiler.frontend.lexer.Token;
import org.syntaxscript.compiler.frontend.lexer.TokenType;
import org.syntaxscript.compiler.frontend.parser.IStatementHandler;
import org.syntaxscript.compiler.frontend.parser.ParsingContext;
import org.syntaxscript.compiler.frontend.parser.ast.Expression;
import org.syntaxscript.compiler.frontend.parser.ast.RuleStatement;
import org.syntaxscript.compiler.frontend.parser.ast.Statement;
import org.syntaxscript.compiler.frontend.parser.ast.StringExpression;
import org.syntaxscript.compiler.util.EditDistance;

import java.util.List;

/**
 * Handles the parsing of the {@code rule} statement.
 * <p>
 * The grammar of the value depends on the rule: boolean rules take {@code true} or {@code false},
 * keyword rules take the word of a keyword declared earlier in the same file.
 */
public class RuleStatementHandler implements IStatementHandler {

    /**
     * Parses {@code rule 'name': value;}.
     * @param context The parsing context.
     * @return A {@link RuleStatement}.
     * @throws ParseException if the rule is unknown, the value does not fit the rule, or the statement is malformed.
     */
    @Override
    public Statement parse(ParsingContext context) throws ParseException {
        Token keyword = context.advance(); // consume 'rule'

        Expression nameExpression = context.parseExpression();
        if (!(nameExpression instanceof StringExpression name)) {
            throw context.error(nameExpression.range(), CompilerErrorCode.UNEXPECTED_TOKEN,
                    "Expected string after 'rule', found '" + nameExpression.value() + "'.");
        }
        RuleDefinition rule = Dictionary.findRule(name.value()).orElseThrow(() ->
                context.error(name.range(), CompilerErrorCode.UNKNOWN_RULE, "Unknown rule '" + name.value() + "'."));

        if (!":".equals(context.peek().value())) {
            throw context.error(context.peek().range(), CompilerErrorCode.UNEXPECTED_TOKEN,
                    "Expected ':' after rule name, found '" + context.peek().value() + "'.");
        }
        context.advance();

        Token value = context.peek();
        if (value.type() != TokenType.IDENTIFIER || !rule.valueType().accepts(value.value())) {
            String expected = rule.valueType() == RuleValueType.BOOLEAN ? "boolean" : "keyword";
            throw context.error(value.range(), CompilerErrorCode.INVALID_RULE_VALUE,
                    "Expected " + expected + " as rule value, found '" + value.value() + "'.");
        }
        if (rule.valueType() == RuleValueType.KEYWORD) {
            List<String> declared = context.declaredKeywords();
            if (!declared.contains(value.value())) {
                throw context.error(value.range(), CompilerErrorCode.UNKNOWN_KEYWORD,
                        "Can't find keyword '" + value.value() + "'.", suggestions(context, value, declared));
            }
        }
        context.advance();
        context.consumeSemicolon();
        return new RuleStatement(rule.name(), value.value(), SourceRange.span(keyword.range(), value.range()), List.of());
    }

    private List<CodeAction> suggestions(ParsingContext context, Token value, List<String> declared) {
        return EditDistance.rank(value.value(), declared).stream()
                .map(word -> CodeAction.quickFix("Replace with '" + word + "'", context.filePath(), new TextEdit(value.range(), word)))
                .toList();
    }
}
