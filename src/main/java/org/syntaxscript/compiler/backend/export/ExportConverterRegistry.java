package org.syntaxscript.compiler.backend.export;

import org.syntaxscript.compiler.backend.export.converters.DefaultExportConverter;
import org.syntaxscript.compiler.backend.export.converters.FunctionExportConverter;
import org.syntaxscript.compiler.backend.export.converters.GlobalExportConverter;
import org.syntaxscript.compiler.backend.export.converters.KeywordExportConverter;
import org.syntaxscript.compiler.backend.export.converters.OperatorExportConverter;
import org.syntaxscript.compiler.frontend.parser.ast.FunctionStatement;
import org.syntaxscript.compiler.frontend.parser.ast.GlobalStatement;
import org.syntaxscript.compiler.frontend.parser.ast.KeywordStatement;
import org.syntaxscript.compiler.frontend.parser.ast.OperatorStatement;
import org.syntaxscript.compiler.frontend.parser.ast.Statement;

import java.util.HashMap;
import java.util.Map;

/**
 * Registry mapping statement classes to export converters, similar in spirit to the
 * {@link org.syntaxscript.compiler.frontend.parser.StatementHandlerRegistry}.
 * <p>
 * Provides explicit registration and a default converter fallback for exportable statements that
 * produce no descriptor, such as rules.
 */
public final class ExportConverterRegistry {

	private final Map<Class<? extends Statement>, IExportConverter<? extends Statement>> byClass = new HashMap<>();
	private final IExportConverter<Statement> defaultConverter;

	private ExportConverterRegistry(IExportConverter<Statement> defaultConverter) {
		this.defaultConverter = defaultConverter;
	}

	/**
	 * Registers a converter for the given statement class.
	 *
	 * @param statementType The concrete statement class.
	 * @param converter     The converter instance handling that class.
	 * @param <T>           Concrete statement type parameter.
	 */
	public <T extends Statement> void register(Class<T> statementType, IExportConverter<T> converter) {
		byClass.put(statementType, converter);
	}

	/**
	 * Resolves the converter for the given statement, falling back to the default converter.
	 *
	 * @param statement The statement to resolve a converter for.
	 * @return A non-null converter to handle the statement.
	 */
	@SuppressWarnings("unchecked")
	public IExportConverter<Statement> resolve(Statement statement) {
		IExportConverter<?> found = byClass.get(statement.getClass());
		if (found != null) return (IExportConverter<Statement>) found;
		return defaultConverter;
	}

	/**
	 * Creates an empty registry with the given default converter.
	 *
	 * @param defaultConverter The fallback converter.
	 * @return A new registry instance.
	 */
	public static ExportConverterRegistry initialize(IExportConverter<Statement> defaultConverter) {
		return new ExportConverterRegistry(defaultConverter);
	}

	/**
	 * Initializes a registry with the default converter and all built-in converters.
	 *
	 * @return A registry pre-populated with the standard converters.
	 */
	public static ExportConverterRegistry initializeWithDefaults() {
		ExportConverterRegistry reg = initialize(new DefaultExportConverter());
		reg.register(OperatorStatement.class, new OperatorExportConverter());
		reg.register(FunctionStatement.class, new FunctionExportConverter());
		reg.register(KeywordStatement.class, new KeywordExportConverter());
		reg.register(GlobalStatement.class, new GlobalExportConverter());
		return reg;
	}
}
