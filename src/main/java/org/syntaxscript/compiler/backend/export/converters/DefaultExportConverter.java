package org.syntaxscript.compiler.backend.export.converters;

import org.syntaxscript.compiler.backend.export.ExportContext;
import org.syntaxscript.compiler.backend.export.IExportConverter;
import org.syntaxscript.compiler.diagnostics.CompilerLogger;
import org.syntaxscript.compiler.frontend.parser.ast.Statement;

/**
 * Default/fallback converter used when no specific converter is registered.
 * Exported rules end up here: they configure the declaring file and emit nothing.
 */
public final class DefaultExportConverter implements IExportConverter<Statement> {

	@Override
	public void convert(Statement statement, ExportContext ctx) {
		CompilerLogger.debug(ctx.filePath(), "no descriptor for {} statement at {}", statement.type(), statement.range().start());
	}
}
