package org.syntaxscript.compiler;

import org.syntaxscript.compiler.api.CodeAction;
import org.syntaxscript.compiler.api.ParseException;
import org.syntaxscript.compiler.api.SourceRange;
import org.syntaxscript.compiler.diagnostics.CompilerLogger;
import org.syntaxscript.compiler.diagnostics.Diagnostic;
import org.syntaxscript.compiler.diagnostics.DiagnosticReport;
import org.syntaxscript.compiler.diagnostics.DiagnosticsEngine;
import org.syntaxscript.compiler.frontend.lexer.Lexer;
import org.syntaxscript.compiler.frontend.lexer.LexerMode;
import org.syntaxscript.compiler.frontend.parser.Parser;
import org.syntaxscript.compiler.frontend.parser.ast.ProgramStatement;
import org.syntaxscript.compiler.frontend.semantics.SemanticAnalyzer;
import org.syntaxscript.compiler.util.ImportPaths;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Produces the diagnostic report an editor shows for one document.
 * <p>
 * A parse error yields exactly one error item and suppresses the semantic checks. Otherwise every
 * check of the {@link SemanticAnalyzer} runs. All ranges of the report are 0-based.
 */
public class DiagnosticReporter {

    /**
     * Reports the diagnostics of a file read from disk.
     * @param filePath A plain path or a {@code file:} URI.
     * @return The report.
     */
    public DiagnosticReport report(String filePath) {
        return report(filePath, null);
    }

    /**
     * Reports the diagnostics of a document.
     * @param filePath A plain path or a {@code file:} URI. Quick fixes are keyed by this string.
     * @param content  The document text, or null to read it from {@code filePath}.
     * @return The report.
     */
    public DiagnosticReport report(String filePath, String content) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        try {
            String text = content != null
                    ? content
                    : Files.readString(ImportPaths.toPath(filePath), StandardCharsets.UTF_8);
            boolean declaration = filePath.endsWith(ImportPaths.DECLARATION_EXTENSION);

            Lexer lexer = new Lexer(text, declaration ? LexerMode.DECLARATION : LexerMode.USAGE);
            Parser parser = new Parser(lexer.scanTokens(), filePath,
                    declaration ? Parser.Grammar.DECLARATION : Parser.Grammar.USAGE);
            ProgramStatement program = parser.parse();

            new SemanticAnalyzer(diagnostics).analyze(program, filePath);
        } catch (ParseException e) {
            CompilerLogger.debug(filePath, "parse error: {}", e.getMessage());
            diagnostics.reportError(e.getMessage(), e.getRange(), e.getActions().toArray(CodeAction[]::new));
        } catch (IOException | IllegalArgumentException e) {
            CompilerLogger.warn(filePath, "could not read: {}", e.getMessage());
            diagnostics.reportWarning("Parser Error: " + e.getMessage(), SourceRange.of(1, 1, 2));
        }

        if (diagnostics.hasErrors() && CompilerLogger.isEnabled(CompilerLogger.DEBUG)) {
            CompilerLogger.debug(filePath, "diagnostics:\n{}", diagnostics.summary());
        }
        return DiagnosticReport.full(diagnostics.getDiagnostics().stream()
                .map(Diagnostic::toZeroBased)
                .toList());
    }
}
