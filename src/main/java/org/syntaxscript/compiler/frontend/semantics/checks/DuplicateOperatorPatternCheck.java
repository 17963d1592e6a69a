package org.syntaxscript.compiler.frontend.semantics.checks;

import org.syntaxscript.compiler.api.CodeAction;
import org.syntaxscript.compiler.api.TextEdit;
import org.syntaxscript.compiler.backend.pattern.OperatorPatternBuilder;
import org.syntaxscript.compiler.diagnostics.DiagnosticsEngine;
import org.syntaxscript.compiler.frontend.parser.ast.GlobalStatement;
import org.syntaxscript.compiler.frontend.parser.ast.OperatorStatement;
import org.syntaxscript.compiler.frontend.parser.ast.ProgramStatement;
import org.syntaxscript.compiler.frontend.parser.ast.Statement;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reports operators whose compiled pattern is textually identical to the pattern of an earlier operator.
 * Patterns that are written differently but match the same text are not detected.
 */
public class DuplicateOperatorPatternCheck implements IDiagnosticCheck {

    @Override
    public void check(ProgramStatement program, String filePath, DiagnosticsEngine diagnostics) {
        checkAll(program.body(), new HashSet<>(), filePath, diagnostics);
    }

    private void checkAll(List<Statement> statements, Set<String> seen, String filePath, DiagnosticsEngine diagnostics) {
        for (Statement statement : statements) {
            if (statement instanceof OperatorStatement operator) {
                String source = OperatorPatternBuilder.build(operator.regex()).source();
                if (!seen.add(source)) {
                    diagnostics.reportError("Regex of this operator is same with another operator.", operator.patternRange(),
                            CodeAction.quickFix("Remove this operator", filePath, TextEdit.delete(operator.range())));
                }
            } else if (statement instanceof GlobalStatement global) {
                checkAll(global.body(), seen, filePath, diagnostics);
            }
        }
    }
}
