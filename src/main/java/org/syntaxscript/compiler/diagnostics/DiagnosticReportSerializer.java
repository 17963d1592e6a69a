package org.syntaxscript.compiler.diagnostics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.syntaxscript.compiler.api.CodeAction;
import org.syntaxscript.compiler.api.TextEdit;

import java.util.List;
import java.util.Map;

/**
 * Renders diagnostic reports as the JSON a language client expects. Code actions are nested as
 * {@code {title, kind, edit: {changes: {file: [edit]}}}} under the {@code data} field of their diagnostic.
 */
public final class DiagnosticReportSerializer {

    private final ObjectMapper mapper;

    /**
     * Creates a serializer with a default {@link ObjectMapper}.
     */
    public DiagnosticReportSerializer() {
        this(new ObjectMapper());
    }

    /**
     * @param mapper The mapper used to render the JSON tree.
     */
    public DiagnosticReportSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Converts a report into a JSON tree.
     * @param report The report.
     * @return The JSON object.
     */
    public ObjectNode toTree(DiagnosticReport report) {
        ObjectNode root = mapper.createObjectNode();
        root.put("kind", report.kind());
        ArrayNode items = root.putArray("items");
        for (Diagnostic diagnostic : report.items()) {
            ObjectNode item = items.addObject();
            item.put("message", diagnostic.message());
            item.set("range", mapper.valueToTree(diagnostic.range()));
            item.set("severity", mapper.valueToTree(diagnostic.severity()));
            item.put("source", diagnostic.source());
            ArrayNode data = item.putArray("data");
            diagnostic.data().forEach(action -> data.add(toTree(action)));
        }
        return root;
    }

    private ObjectNode toTree(CodeAction action) {
        ObjectNode node = mapper.createObjectNode();
        node.put("title", action.title());
        node.put("kind", action.kind());
        ObjectNode changes = node.putObject("edit").putObject("changes");
        for (Map.Entry<String, List<TextEdit>> entry : action.changes().entrySet()) {
            changes.set(entry.getKey(), mapper.valueToTree(entry.getValue()));
        }
        return node;
    }

    /**
     * Renders a report as a JSON string.
     * @param report The report.
     * @return The JSON text.
     * @throws JsonProcessingException if the tree cannot be written.
     */
    public String toJson(DiagnosticReport report) throws JsonProcessingException {
        return mapper.writeValueAsString(toTree(report));
    }
}
