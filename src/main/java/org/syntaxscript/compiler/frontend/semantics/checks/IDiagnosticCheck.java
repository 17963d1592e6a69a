package org.syntaxscript.compiler.frontend.semantics.checks;

import org.syntaxscript.compiler.diagnostics.DiagnosticsEngine;
import org.syntaxscript.compiler.frontend.parser.ast.ProgramStatement;

/**
 * Interface for the independent checks run on a successfully parsed file.
 * Checks report with 1-based ranges; the report converts them for the client.
 */
@FunctionalInterface
public interface IDiagnosticCheck {
    /**
     * Checks a parsed file.
     * @param program The parsed file.
     * @param filePath The path of the file exactly as given by the caller, used to key quick fix edits.
     * @param diagnostics The engine for reporting findings.
     */
    void check(ProgramStatement program, String filePath, DiagnosticsEngine diagnostics);
}
