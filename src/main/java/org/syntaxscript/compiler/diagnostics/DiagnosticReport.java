package org.syntaxscript.compiler.diagnostics;

import java.util.List;

/**
 * A full diagnostic report for one document.
 *
 * @param kind  Always {@link #FULL}.
 * @param items The diagnostics, with 0-based ranges.
 */
public record DiagnosticReport(String kind, List<Diagnostic> items) {

    /** The report kind of a report listing every diagnostic of the document. */
    public static final String FULL = "full";

    public DiagnosticReport {
        items = List.copyOf(items);
    }

    /**
     * @param items The diagnostics.
     * @return A full report of the given diagnostics.
     */
    public static DiagnosticReport full(List<Diagnostic> items) {
        return new DiagnosticReport(FULL, items);
    }
}
