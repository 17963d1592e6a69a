package org.syntaxscript.compiler.backend.export.converters;

import org.syntaxscript.compiler.backend.export.ExportContext;
import org.syntaxscript.compiler.backend.export.ExportedKeyword;
import org.syntaxscript.compiler.backend.export.IExportConverter;
import org.syntaxscript.compiler.frontend.parser.ast.KeywordStatement;

/**
 * Converts an exported keyword into an {@link ExportedKeyword}.
 */
public final class KeywordExportConverter implements IExportConverter<KeywordStatement> {

	@Override
	public void convert(KeywordStatement keyword, ExportContext ctx) {
		ctx.emit(new ExportedKeyword(keyword.word()));
	}
}
