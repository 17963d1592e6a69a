package org.syntaxscript.compiler.frontend.semantics.checks;

import org.syntaxscript.compiler.api.CodeAction;
import org.syntaxscript.compiler.api.TextEdit;
import org.syntaxscript.compiler.diagnostics.DiagnosticsEngine;
import org.syntaxscript.compiler.frontend.parser.ast.ImportStatement;
import org.syntaxscript.compiler.frontend.parser.ast.ProgramStatement;
import org.syntaxscript.compiler.frontend.parser.ast.Statement;
import org.syntaxscript.compiler.util.ImportPaths;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reports imports that do not resolve to a declaration file on disk. The path is resolved the same
 * way usage compilation resolves it, so the target always carries the declaration extension.
 */
public class UnresolvedImportCheck implements IDiagnosticCheck {

    @Override
    public void check(ProgramStatement program, String filePath, DiagnosticsEngine diagnostics) {
        Path importingFile = ImportPaths.toPath(filePath);
        for (Statement statement : program.body()) {
            if (!(statement instanceof ImportStatement importStatement)) continue;

            Path target = ImportPaths.resolve(importingFile, importStatement.path());
            String problem = null;
            if (!Files.exists(target)) {
                problem = "Can't find file '" + target + "' imported from '" + importingFile + "'.";
            } else if (!Files.isRegularFile(target)) {
                problem = "'" + target + "' imported from '" + importingFile + "' doesn't seem to be a file.";
            }
            if (problem != null) {
                diagnostics.reportError(problem, importStatement.range(),
                        CodeAction.quickFix("Remove this import statement", filePath, TextEdit.delete(importStatement.range().extendEnd(1))));
            }
        }
    }
}
