package org.syntaxscript.compiler.backend.export;

import org.syntaxscript.compiler.api.CompilationException;
import org.syntaxscript.compiler.frontend.parser.ast.Statement;

/**
 * Converts one kind of exported statement into zero or more descriptors.
 * <p>
 * Implementations should be stateless. All output must be emitted via the provided {@link ExportContext}.
 *
 * @param <T> The concrete statement type handled by this converter.
 */
public interface IExportConverter<T extends Statement> {

	/**
	 * Converts the given statement and emits its descriptors via the context.
	 *
	 * @param statement The exported statement.
	 * @param ctx       The export context.
	 * @throws CompilationException if the statement cannot be compiled into a descriptor.
	 */
	void convert(T statement, ExportContext ctx) throws CompilationException;
}
