package org.syntaxscript.compiler.diagnostics;

import org.syntaxscript.compiler.api.CodeAction;
import org.syntaxscript.compiler.api.SourceRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * found in a source file.
 * <p>
 * This decouples error reporting from the checks producing them.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message The error message.
     * @param range   The 1-based range of the error.
     * @param actions Quick fixes for the error.
     */
    public void reportError(String message, SourceRange range, CodeAction... actions) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.ERROR, message, range, Diagnostic.SOURCE, List.of(actions)));
    }

    /**
     * Reports a warning.
     *
     * @param message The warning message.
     * @param range   The 1-based range of the warning.
     * @param actions Quick fixes for the warning.
     */
    public void reportWarning(String message, SourceRange range, CodeAction... actions) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.WARNING, message, range, Diagnostic.SOURCE, List.of(actions)));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Diagnostic.Severity.ERROR);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
