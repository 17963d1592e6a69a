package org.syntaxscript.compiler.frontend.parser.features.export;

import org.syntaxscript.compiler.api.CodeAction;
import org.syntaxscript.compiler.api.CompilerErrorCode;
import org.syntaxscript.compiler.api.ParseException;
import org.syntaxscript.compiler.api.TextEdit;
import org.syntaxscript.compiler.dictionary.Dictionary;
import org.syntaxscript.compiler.frontend.lexer.Token;
import org.syntaxscript.compiler.frontend.parser.IStatementHandler;
import org.syntaxscript.compiler.frontend.parser.ParsingContext;
import org.syntaxscript.compiler.frontend.parser.ast.Statement;

import java.util.List;

/**
 * Handles the {@code export} modifier. It re-enters statement parsing and attaches itself to the
 * following statement instead of producing a node of its own.
 */
public class ExportStatementHandler implements IStatementHandler {

    @Override
    public Statement parse(ParsingContext context) throws ParseException {
        Token export = context.advance(); // consume 'export'
        Statement statement = context.parseStatement();
        if (!Dictionary.isExportable(statement.type())) {
            CodeAction removeExport = CodeAction.quickFix("Remove export keyword", context.filePath(), TextEdit.delete(export.range()));
            throw context.error(statement.range(), CompilerErrorCode.NOT_EXPORTABLE,
                    "Expected exportable statement after export.", List.of(removeExport));
        }
        return statement.withModifier(export);
    }
}
