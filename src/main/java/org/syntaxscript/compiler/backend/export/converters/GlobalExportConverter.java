package org.syntaxscript.compiler.backend.export.converters;

import org.syntaxscript.compiler.api.CompilationException;
import org.syntaxscript.compiler.backend.export.ExportContext;
import org.syntaxscript.compiler.backend.export.ExportedGlobal;
import org.syntaxscript.compiler.backend.export.IExportConverter;
import org.syntaxscript.compiler.frontend.parser.ast.GlobalStatement;

/**
 * Converts an exported global into an {@link ExportedGlobal} carrying the descriptors of its
 * own exported members.
 */
public final class GlobalExportConverter implements IExportConverter<GlobalStatement> {

	@Override
	public void convert(GlobalStatement global, ExportContext ctx) throws CompilationException {
		ctx.emit(new ExportedGlobal(global.name(), ctx.convertExported(global.body())));
	}
}
