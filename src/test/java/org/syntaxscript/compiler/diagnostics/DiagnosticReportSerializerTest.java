package org.syntaxscript.compiler.diagnostics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.syntaxscript.compiler.api.CodeAction;
import org.syntaxscript.compiler.api.SourceRange;
import org.syntaxscript.compiler.api.TextEdit;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link DiagnosticReportSerializer} and the {@link DiagnosticsEngine}
 * feeding it. They verify the JSON shape language clients expect.
 */
public class DiagnosticReportSerializerTest {

    /**
     * Verifies the JSON of a report with one warning carrying a quick fix.
     * This is a unit test for the serializer.
     */
    @Test
    @Tag("unit")
    void testReportJson() throws JsonProcessingException {
        // Arrange
        DiagnosticsEngine engine = new DiagnosticsEngine();
        engine.reportWarning("Rule 'a' conflicts with 'b', both of them should not be defined.", SourceRange.of(2, 1, 10),
                CodeAction.quickFix("Remove a definition", "file:///x.syx", TextEdit.delete(SourceRange.of(2, 1, 11))));
        DiagnosticReport report = DiagnosticReport.full(engine.getDiagnostics().stream().map(Diagnostic::toZeroBased).toList());

        // Act
        String json = new DiagnosticReportSerializer().toJson(report);
        JsonNode tree = new ObjectMapper().readTree(json);

        // Assert
        assertThat(tree.get("kind").asText()).isEqualTo("full");
        JsonNode item = tree.get("items").get(0);
        assertThat(item.get("severity").asInt()).isEqualTo(2);
        assertThat(item.get("source").asText()).isEqualTo("syntax-script");
        assertThat(item.at("/range/start/line").asInt()).isEqualTo(1);
        assertThat(item.at("/range/start/character").asInt()).isZero();
        assertThat(item.at("/range/end/character").asInt()).isEqualTo(9);

        JsonNode action = item.get("data").get(0);
        assertThat(action.get("title").asText()).isEqualTo("Remove a definition");
        assertThat(action.get("kind").asText()).isEqualTo("quickfix");
        JsonNode edit = action.get("edit").get("changes").get("file:///x.syx").get(0);
        assertThat(edit.get("newText").asText()).isEmpty();
        assertThat(edit.at("/range/end/character").asInt()).isEqualTo(10);
    }

    /**
     * Verifies the severity codes and the engine's error bookkeeping.
     * This is a unit test for the diagnostics engine.
     */
    @Test
    @Tag("unit")
    void testEngine() {
        // Arrange
        DiagnosticsEngine engine = new DiagnosticsEngine();

        // Act
        engine.reportWarning("careful", SourceRange.ORIGIN);
        boolean afterWarning = engine.hasErrors();
        engine.reportError("broken", SourceRange.of(1, 1, 2));

        // Assert
        assertThat(afterWarning).isFalse();
        assertThat(engine.hasErrors()).isTrue();
        assertThat(engine.getDiagnostics()).extracting(Diagnostic::severity)
                .containsExactly(Diagnostic.Severity.WARNING, Diagnostic.Severity.ERROR);
        assertThat(engine.summary()).contains("careful").contains("broken");
        assertThat(List.of(Diagnostic.Severity.ERROR.code(), Diagnostic.Severity.WARNING.code())).containsExactly(1, 2);
    }
}
