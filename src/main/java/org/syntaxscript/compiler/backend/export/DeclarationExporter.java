package org.syntaxscript.compiler.backend.export;

import org.syntaxscript.compiler.api.CompilationException;
import org.syntaxscript.compiler.frontend.parser.ast.ProgramStatement;
import org.syntaxscript.compiler.frontend.parser.ast.Statement;

import java.util.List;

/**
 * Phase: builds the descriptors of a parsed declaration file by dispatching each exported
 * top-level statement to a converter resolved via the {@link ExportConverterRegistry}.
 */
public final class DeclarationExporter {

	private final ExportConverterRegistry registry;

	/**
	 * @param registry The converter registry.
	 */
	public DeclarationExporter(ExportConverterRegistry registry) {
		this.registry = registry;
	}

	/**
	 * Exports a declaration file.
	 *
	 * @param program  The parsed file.
	 * @param filePath The file path, used in errors.
	 * @return The descriptors in source order.
	 * @throws CompilationException if an exported statement cannot be compiled.
	 */
	public List<ExportedDescriptor> export(ProgramStatement program, String filePath) throws CompilationException {
		ExportContext ctx = new ExportContext(filePath, registry);
		for (Statement statement : program.body()) {
			if (statement.isExported()) {
				registry.resolve(statement).convert(statement, ctx);
			}
		}
		return ctx.descriptors();
	}
}
