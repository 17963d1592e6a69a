package org.syntaxscript.compiler.frontend.semantics.checks;

import org.syntaxscript.compiler.api.CodeAction;
import org.syntaxscript.compiler.api.TextEdit;
import org.syntaxscript.compiler.diagnostics.DiagnosticsEngine;
import org.syntaxscript.compiler.dictionary.Dictionary;
import org.syntaxscript.compiler.frontend.lexer.Token;
import org.syntaxscript.compiler.frontend.parser.ast.FunctionStatement;
import org.syntaxscript.compiler.frontend.parser.ast.GlobalStatement;
import org.syntaxscript.compiler.frontend.parser.ast.OperatorStatement;
import org.syntaxscript.compiler.frontend.parser.ast.ProgramStatement;
import org.syntaxscript.compiler.frontend.parser.ast.Statement;

import java.util.List;
import java.util.Optional;

/**
 * Reports {@code export} modifiers on statements that cannot be exported, including statements
 * nested in operator, function and global bodies.
 */
public class ExportableCheck implements IDiagnosticCheck {

    @Override
    public void check(ProgramStatement program, String filePath, DiagnosticsEngine diagnostics) {
        checkAll(program.body(), filePath, diagnostics);
    }

    private void checkAll(List<Statement> statements, String filePath, DiagnosticsEngine diagnostics) {
        for (Statement statement : statements) {
            Optional<Token> export = statement.exportModifier();
            if (export.isPresent() && !Dictionary.isExportable(statement.type())) {
                diagnostics.reportError("This statement cannot be exported.", statement.range(),
                        CodeAction.quickFix("Remove export keyword", filePath, TextEdit.delete(export.get().range())));
            }
            if (Dictionary.NODE_TYPES_WITH_BODY.contains(statement.type())) {
                checkAll(bodyOf(statement), filePath, diagnostics);
            }
        }
    }

    private List<Statement> bodyOf(Statement statement) {
        if (statement instanceof OperatorStatement operator) return operator.body();
        if (statement instanceof FunctionStatement function) return function.body();
        if (statement instanceof GlobalStatement global) return global.body();
        return List.of();
    }
}
