package org.syntaxscript.compiler.backend.pattern;

import org.syntaxscript.compiler.api.CompilationException;
import org.syntaxscript.compiler.api.CompilerErrorCode;
import org.syntaxscript.compiler.api.ParseException;
import org.syntaxscript.compiler.frontend.lexer.Lexer;
import org.syntaxscript.compiler.frontend.parser.Parser;
import org.syntaxscript.compiler.frontend.parser.ast.CompileStatement;
import org.syntaxscript.compiler.frontend.parser.ast.OperatorStatement;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.regex.Matcher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for {@link OperatorPatternBuilder} and {@link OutputTemplate}.
 * These tests verify the regular expression built from operator fragments, the capture provenance
 * recorded for each placeholder and the rendering of compile templates against a match.
 */
public class OperatorPatternBuilderTest {

    private OperatorStatement operator(String source) throws ParseException {
        return (OperatorStatement) new Parser(new Lexer(source).scanTokens(), "ops.syx", Parser.Grammar.DECLARATION)
                .parse().body().get(0);
    }

    /**
     * Verifies the pattern source of an addition operator.
     * This is a unit test for the pattern builder.
     */
    @Test
    @Tag("unit")
    void testAdditionPattern() throws ParseException {
        // Act
        CompiledPattern pattern = OperatorPatternBuilder.build(operator("operator <int> +s '+' +s <int> {}").regex());

        // Assert
        assertThat(pattern.source()).isEqualTo("([0-9]+)\\s*\\+\\s*([0-9]+)");
        assertThat(pattern.captures()).containsExactly(
                new CompiledPattern.Capture("int", 0, 1),
                new CompiledPattern.Capture("int", 1, 2));
    }

    /**
     * Verifies that capture groups opened inside a placeholder pattern shift the groups of later placeholders.
     * This is a unit test for the pattern builder.
     */
    @Test
    @Tag("unit")
    void testDecimalShiftsLaterGroups() throws ParseException {
        // Act
        CompiledPattern pattern = OperatorPatternBuilder.build(operator("operator <decimal> '..' <int> <decimal> {}").regex());

        // Assert
        assertThat(pattern.captures()).containsExactly(
                new CompiledPattern.Capture("decimal", 0, 1),
                new CompiledPattern.Capture("int", 0, 3),
                new CompiledPattern.Capture("decimal", 1, 4));
        assertThat(pattern.find("decimal", 1)).map(CompiledPattern.Capture::group).contains(4);
        assertThat(pattern.find("string", 0)).isEmpty();
    }

    @Test
    @Tag("unit")
    void testEscape() {
        assertThat(OperatorPatternBuilder.escape("a.b*(c)|[d]\\^$?{}+")).isEqualTo("a\\.b\\*\\(c\\)\\|\\[d\\]\\\\\\^\\$\\?\\{\\}\\+");
        assertThat(OperatorPatternBuilder.escape("plain")).isEqualTo("plain");
    }

    /**
     * Verifies that a template renders captures of the original match, literals and whitespace.
     * This is a unit test for the output template.
     */
    @Test
    @Tag("unit")
    void testRenderTemplate() throws Exception {
        // Arrange
        OperatorStatement statement = operator("operator <decimal> '^' <int> { compile(ts) 'Math.pow(' decimal|0 ',' +s int|0 ')'; }");
        CompiledPattern pattern = OperatorPatternBuilder.build(statement.regex());
        OutputTemplate template = OutputTemplate.of((CompileStatement) statement.body().get(0), pattern, "ops.syx");
        Matcher matcher = pattern.toPattern().matcher("2.5^3");

        // Act
        boolean found = matcher.find();
        String rendered = template.render(matcher);

        // Assert
        assertThat(found).isTrue();
        assertThat(rendered).isEqualTo("Math.pow(2.5, 3)");
    }

    /**
     * Verifies that a template referencing a placeholder the pattern lacks is rejected.
     * This is a unit test for the output template.
     */
    @Test
    @Tag("unit")
    void testUnknownCapture() throws ParseException {
        // Arrange
        OperatorStatement statement = operator("operator <int> '!' { compile(ts) int|1; }");
        CompiledPattern pattern = OperatorPatternBuilder.build(statement.regex());

        // Act & Assert
        assertThatThrownBy(() -> OutputTemplate.of((CompileStatement) statement.body().get(0), pattern, "ops.syx"))
                .isInstanceOf(CompilationException.class)
                .hasMessage("Unknown capture 'int|1' in compile statement.")
                .extracting(e -> ((CompilationException) e).getCode())
                .isEqualTo(CompilerErrorCode.UNKNOWN_CAPTURE);
    }
}
