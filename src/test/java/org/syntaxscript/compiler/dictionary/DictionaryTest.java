package org.syntaxscript.compiler.dictionary;

import org.syntaxscript.compiler.frontend.lexer.Lexer;
import org.syntaxscript.compiler.frontend.lexer.Token;
import org.syntaxscript.compiler.frontend.lexer.TokenType;
import org.syntaxscript.compiler.frontend.parser.ast.NodeType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the static tables of the {@link Dictionary}.
 */
public class DictionaryTest {

    /**
     * Verifies that a conflict declared by one rule applies in both directions.
     */
    @Test
    @Tag("unit")
    void testConflictsAreSymmetric() {
        for (RuleDefinition rule : Dictionary.RULES) {
            for (RuleDefinition other : Dictionary.RULES) {
                assertThat(Dictionary.conflicting(rule.name(), other.name()))
                        .isEqualTo(Dictionary.conflicting(other.name(), rule.name()));
            }
        }
        assertThat(Dictionary.conflicting("enforce-double-string-quotes", "enforce-single-string-quotes")).isTrue();
        assertThat(Dictionary.conflicting("imports-keyword", "function-value-return-keyword")).isFalse();
    }

    /**
     * Verifies the value types and defaults of the rules.
     */
    @Test
    @Tag("unit")
    void testRuleDefaults() {
        assertThat(Dictionary.findRule("imports-keyword")).hasValueSatisfying(rule -> {
            assertThat(rule.valueType()).isEqualTo(RuleValueType.KEYWORD);
            assertThat(rule.defaultValue()).isEqualTo("import");
        });
        assertThat(Dictionary.findRule("function-value-return-enabled"))
                .map(RuleDefinition::valueType).contains(RuleValueType.BOOLEAN);
        assertThat(Dictionary.findRule("custom-random-rule?")).isEmpty();
        assertThat(Dictionary.RULES).allSatisfy(rule -> assertThat(rule.valueType().accepts(rule.defaultValue())).isTrue());
    }

    /**
     * Verifies that every reserved keyword is lexed as a keyword token.
     */
    @Test
    @Tag("unit")
    void testReservedKeywordsMatchLexer() {
        // Act
        List<Token> tokens = new Lexer(String.join(" ", Dictionary.RESERVED_KEYWORDS)).scanTokens();

        // Assert
        assertThat(tokens.subList(0, tokens.size() - 1))
                .hasSize(Dictionary.RESERVED_KEYWORDS.size())
                .noneMatch(t -> t.type() == TokenType.IDENTIFIER);
    }

    @Test
    @Tag("unit")
    void testPrimitiveTypesAndExportables() {
        assertThat(Dictionary.PRIMITIVE_TYPES).containsExactly("int", "string", "boolean", "decimal");
        assertThat(PrimitiveType.fromName("decimal")).contains(PrimitiveType.DECIMAL);
        assertThat(PrimitiveType.fromName("Int")).isEmpty();
        assertThat(Dictionary.isExportable(NodeType.RULE)).isTrue();
        assertThat(Dictionary.isExportable(NodeType.IMPORT)).isFalse();
        assertThat(RuleValueType.BOOLEAN.accepts("maybe")).isFalse();
        assertThat(RuleValueType.KEYWORD.accepts("ruleish")).isTrue();
    }
}
