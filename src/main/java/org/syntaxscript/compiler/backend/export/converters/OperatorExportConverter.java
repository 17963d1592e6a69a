package org.syntaxscript.compiler.backend.export.converters;

import org.syntaxscript.compiler.api.CompilationException;
import org.syntaxscript.compiler.api.CompilerErrorCode;
import org.syntaxscript.compiler.backend.export.ExportContext;
import org.syntaxscript.compiler.backend.export.ExportedOperator;
import org.syntaxscript.compiler.backend.export.IExportConverter;
import org.syntaxscript.compiler.backend.pattern.CompiledPattern;
import org.syntaxscript.compiler.backend.pattern.OperatorPatternBuilder;
import org.syntaxscript.compiler.backend.pattern.OutputTemplate;
import org.syntaxscript.compiler.frontend.parser.ast.CompileStatement;
import org.syntaxscript.compiler.frontend.parser.ast.ImportsStatement;
import org.syntaxscript.compiler.frontend.parser.ast.OperatorStatement;
import org.syntaxscript.compiler.frontend.parser.ast.Statement;

import java.util.HashMap;
import java.util.Map;

/**
 * Converts an exported operator into an {@link ExportedOperator}: its compiled pattern plus
 * one output template and at most one required module per target format.
 */
public final class OperatorExportConverter implements IExportConverter<OperatorStatement> {

	@Override
	public void convert(OperatorStatement operator, ExportContext ctx) throws CompilationException {
		CompiledPattern pattern = OperatorPatternBuilder.build(operator.regex());
		Map<String, OutputTemplate> generators = new HashMap<>();
		Map<String, String> imports = new HashMap<>();

		for (Statement clause : operator.body()) {
			if (clause instanceof CompileStatement compile) {
				OutputTemplate template = OutputTemplate.of(compile, pattern, ctx.filePath());
				for (String format : compile.formats()) {
					if (generators.putIfAbsent(format, template) != null) {
						throw new CompilationException(CompilerErrorCode.DUPLICATE_TARGET_FORMAT,
								"Duplicate file format at compile statement '" + format + "'.", compile.range(), ctx.filePath());
					}
				}
			} else if (clause instanceof ImportsStatement importsClause) {
				for (String format : importsClause.formats()) {
					if (imports.putIfAbsent(format, importsClause.module()) != null) {
						throw new CompilationException(CompilerErrorCode.DUPLICATE_TARGET_FORMAT,
								"Duplicate file format at imports statement '" + format + "'.", importsClause.range(), ctx.filePath());
					}
				}
			}
		}
		ctx.emit(new ExportedOperator(pattern, generators, imports));
	}
}
