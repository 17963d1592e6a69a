package org.syntaxscript.compiler.frontend.semantics.checks;

import org.syntaxscript.compiler.api.CodeAction;
import org.syntaxscript.compiler.api.TextEdit;
import org.syntaxscript.compiler.diagnostics.DiagnosticsEngine;
import org.syntaxscript.compiler.frontend.parser.ast.ProgramStatement;
import org.syntaxscript.compiler.frontend.parser.ast.RuleStatement;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reports every definition of a rule that is defined more than once.
 */
public class DuplicateRuleCheck implements IDiagnosticCheck {

    @Override
    public void check(ProgramStatement program, String filePath, DiagnosticsEngine diagnostics) {
        List<RuleStatement> rules = program.body().stream()
                .filter(RuleStatement.class::isInstance)
                .map(RuleStatement.class::cast)
                .toList();
        Map<String, Long> counts = rules.stream()
                .collect(Collectors.groupingBy(RuleStatement::rule, Collectors.counting()));

        for (RuleStatement rule : rules) {
            if (counts.get(rule.rule()) > 1) {
                diagnostics.reportError("Rule '" + rule.rule() + "' is already defined.", rule.range(),
                        CodeAction.quickFix("Remove this definition", filePath, TextEdit.delete(rule.range().extendEnd(1))));
            }
        }
    }
}
