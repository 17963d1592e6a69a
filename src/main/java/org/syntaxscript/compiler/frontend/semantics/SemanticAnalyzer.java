package org.syntaxscript.compiler.frontend.semantics;

import org.syntaxscript.compiler.diagnostics.DiagnosticsEngine;
import org.syntaxscript.compiler.frontend.parser.ast.ProgramStatement;
import org.syntaxscript.compiler.frontend.semantics.checks.DuplicateNameCheck;
import org.syntaxscript.compiler.frontend.semantics.checks.DuplicateOperatorPatternCheck;
import org.syntaxscript.compiler.frontend.semantics.checks.DuplicateRuleCheck;
import org.syntaxscript.compiler.frontend.semantics.checks.ExportableCheck;
import org.syntaxscript.compiler.frontend.semantics.checks.IDiagnosticCheck;
import org.syntaxscript.compiler.frontend.semantics.checks.RuleConflictCheck;
import org.syntaxscript.compiler.frontend.semantics.checks.UnresolvedImportCheck;

import java.util.ArrayList;
import java.util.List;

/**
 * Performs semantic analysis on a parsed file. It runs independent checks in a fixed order and
 * collects their findings in the {@link DiagnosticsEngine}, so the resulting diagnostic list is
 * deterministic for identical input.
 */
public class SemanticAnalyzer {

    private final DiagnosticsEngine diagnostics;
    private final List<IDiagnosticCheck> checks = new ArrayList<>();

    /**
     * Constructs a new semantic analyzer with the default checks.
     * @param diagnostics The diagnostics engine for reporting findings.
     */
    public SemanticAnalyzer(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
        registerDefaultChecks();
    }

    private void registerDefaultChecks() {
        checks.add(new ExportableCheck());
        checks.add(new RuleConflictCheck());
        checks.add(new DuplicateRuleCheck());
        checks.add(new UnresolvedImportCheck());
        checks.add(new DuplicateOperatorPatternCheck());
        checks.add(new DuplicateNameCheck());
    }

    /**
     * Analyzes a parsed file.
     * @param program  The parsed file.
     * @param filePath The path of the file exactly as given by the caller.
     */
    public void analyze(ProgramStatement program, String filePath) {
        for (IDiagnosticCheck check : checks) {
            check.check(program, filePath, diagnostics);
        }
    }
}
