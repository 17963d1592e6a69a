package org.syntaxscript.compiler.backend.export.converters;

import org.syntaxscript.compiler.api.CompilationException;
import org.syntaxscript.compiler.api.CompilerErrorCode;
import org.syntaxscript.compiler.backend.export.ExportContext;
import org.syntaxscript.compiler.backend.export.ExportedFunction;
import org.syntaxscript.compiler.backend.export.IExportConverter;
import org.syntaxscript.compiler.dictionary.PrimitiveType;
import org.syntaxscript.compiler.frontend.parser.ast.CompileStatement;
import org.syntaxscript.compiler.frontend.parser.ast.FunctionStatement;
import org.syntaxscript.compiler.frontend.parser.ast.ImportsStatement;
import org.syntaxscript.compiler.frontend.parser.ast.Statement;
import org.syntaxscript.compiler.frontend.parser.ast.StringExpression;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts an exported function into an {@link ExportedFunction}. The compile clause of a function
 * names the function the call is renamed to, so its template must start with a string.
 */
public final class FunctionExportConverter implements IExportConverter<FunctionStatement> {

	@Override
	public void convert(FunctionStatement function, ExportContext ctx) throws CompilationException {
		List<String> argumentPatterns = function.arguments().stream()
				.map(name -> PrimitiveType.fromName(name).map(PrimitiveType::pattern)
						.orElseThrow(() -> new IllegalStateException("Unknown primitive type: " + name)))
				.toList();
		Map<String, String> formatNames = new HashMap<>();
		Map<String, String> imports = new HashMap<>();

		for (Statement clause : function.body()) {
			if (clause instanceof CompileStatement compile) {
				if (compile.body().isEmpty() || !(compile.body().get(0) instanceof StringExpression rename)) {
					throw new CompilationException(CompilerErrorCode.INVALID_FUNCTION_TEMPLATE,
							"Expected a string after compile statement parens.", compile.range(), ctx.filePath());
				}
				for (String format : compile.formats()) {
					if (formatNames.putIfAbsent(format, rename.value()) != null) {
						throw new CompilationException(CompilerErrorCode.DUPLICATE_TARGET_FORMAT,
								"Encountered multiple compile statements for target language '" + format + "'.", compile.range(), ctx.filePath());
					}
				}
			} else if (clause instanceof ImportsStatement importsClause) {
				for (String format : importsClause.formats()) {
					if (imports.putIfAbsent(format, importsClause.module()) != null) {
						throw new CompilationException(CompilerErrorCode.DUPLICATE_TARGET_FORMAT,
								"Encountered multiple import statements for target language '" + format + "'.", importsClause.range(), ctx.filePath());
					}
				}
			}
		}
		ctx.emit(new ExportedFunction(function.name(), argumentPatterns, formatNames, imports));
	}
}
