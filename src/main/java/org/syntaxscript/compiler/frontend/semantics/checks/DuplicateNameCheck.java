package org.syntaxscript.compiler.frontend.semantics.checks;

import org.syntaxscript.compiler.diagnostics.DiagnosticsEngine;
import org.syntaxscript.compiler.frontend.parser.ast.FunctionStatement;
import org.syntaxscript.compiler.frontend.parser.ast.GlobalStatement;
import org.syntaxscript.compiler.frontend.parser.ast.KeywordStatement;
import org.syntaxscript.compiler.frontend.parser.ast.ProgramStatement;
import org.syntaxscript.compiler.frontend.parser.ast.Statement;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reports functions, globals and keywords that reuse a name already declared in the same body.
 * The top level of a file and the body of every global are separate scopes.
 */
public class DuplicateNameCheck implements IDiagnosticCheck {

    @Override
    public void check(ProgramStatement program, String filePath, DiagnosticsEngine diagnostics) {
        checkScope(program.body(), diagnostics);
    }

    private void checkScope(List<Statement> statements, DiagnosticsEngine diagnostics) {
        Set<String> names = new HashSet<>();
        for (Statement statement : statements) {
            String name = nameOf(statement);
            if (name != null && !names.add(name)) {
                diagnostics.reportError("Name '" + name + "' is already used in this scope.", statement.range());
            }
            if (statement instanceof GlobalStatement global) {
                checkScope(global.body(), diagnostics);
            }
        }
    }

    private String nameOf(Statement statement) {
        if (statement instanceof FunctionStatement function) return function.name();
        if (statement instanceof GlobalStatement global) return global.name();
        if (statement instanceof KeywordStatement keyword) return keyword.word();
        return null;
    }
}
