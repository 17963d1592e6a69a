package org.syntaxscript.compiler.backend.export;

import org.syntaxscript.compiler.api.CompilationException;
import org.syntaxscript.compiler.frontend.parser.ast.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the descriptors emitted while exporting one declaration file.
 */
public final class ExportContext {

	private final String filePath;
	private final ExportConverterRegistry registry;
	private final List<ExportedDescriptor> descriptors = new ArrayList<>();

	/**
	 * @param filePath The declaration file, used in errors.
	 * @param registry The registry used to convert nested statements.
	 */
	public ExportContext(String filePath, ExportConverterRegistry registry) {
		this.filePath = filePath;
		this.registry = registry;
	}

	/**
	 * @return The declaration file being exported.
	 */
	public String filePath() {
		return filePath;
	}

	/**
	 * Emits a descriptor.
	 * @param descriptor The descriptor.
	 */
	public void emit(ExportedDescriptor descriptor) {
		descriptors.add(descriptor);
	}

	/**
	 * Converts the exported statements among the given ones in a fresh context. Global converters
	 * use it for their members, which become part of the global's descriptor rather than this context's.
	 * @param statements The statements.
	 * @return The descriptors of the exported statements, in source order.
	 * @throws CompilationException if a statement cannot be converted.
	 */
	public List<ExportedDescriptor> convertExported(List<Statement> statements) throws CompilationException {
		ExportContext nested = new ExportContext(filePath, registry);
		for (Statement statement : statements) {
			if (statement.isExported()) {
				registry.resolve(statement).convert(statement, nested);
			}
		}
		return nested.descriptors();
	}

	/**
	 * @return The emitted descriptors in emission order.
	 */
	public List<ExportedDescriptor> descriptors() {
		return List.copyOf(descriptors);
	}
}
