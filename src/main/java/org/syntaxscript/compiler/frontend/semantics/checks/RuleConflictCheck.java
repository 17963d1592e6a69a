package org.syntaxscript.compiler.frontend.semantics.checks;

import org.syntaxscript.compiler.api.CodeAction;
import org.syntaxscript.compiler.api.TextEdit;
import org.syntaxscript.compiler.diagnostics.DiagnosticsEngine;
import org.syntaxscript.compiler.dictionary.Dictionary;
import org.syntaxscript.compiler.frontend.parser.ast.ProgramStatement;
import org.syntaxscript.compiler.frontend.parser.ast.RuleStatement;

import java.util.List;

/**
 * Warns about rules that must not be set together. A conflict declared by either rule applies to
 * both, so each statement of a conflicting pair gets its own warning. Both warnings offer to remove
 * either statement.
 */
public class RuleConflictCheck implements IDiagnosticCheck {

    @Override
    public void check(ProgramStatement program, String filePath, DiagnosticsEngine diagnostics) {
        List<RuleStatement> rules = program.body().stream()
                .filter(RuleStatement.class::isInstance)
                .map(RuleStatement.class::cast)
                .toList();

        for (RuleStatement rule : rules) {
            for (RuleStatement other : rules) {
                if (other == rule || !Dictionary.conflicting(rule.rule(), other.rule())) continue;
                diagnostics.reportWarning(
                        "Rule '" + rule.rule() + "' conflicts with '" + other.rule() + "', both of them should not be defined.",
                        rule.range(),
                        removal(rule, filePath),
                        removal(other, filePath));
            }
        }
    }

    private CodeAction removal(RuleStatement rule, String filePath) {
        return CodeAction.quickFix("Remove " + rule.rule() + " definition", filePath, TextEdit.delete(rule.range().extendEnd(1)));
    }
}
