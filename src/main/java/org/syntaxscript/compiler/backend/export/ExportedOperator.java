package org.syntaxscript.compiler.backend.export;

import org.syntaxscript.compiler.backend.pattern.CompiledPattern;
import org.syntaxscript.compiler.backend.pattern.OutputTemplate;

import java.util.Map;

/**
 * An exported operator.
 *
 * @param pattern          The compiled pattern matched against usage file bodies.
 * @param outputGenerators The output template per target format.
 * @param imports          The module each target format needs, if any.
 */
public record ExportedOperator(
		CompiledPattern pattern,
		Map<String, OutputTemplate> outputGenerators,
		Map<String, String> imports
) implements ExportedDescriptor {

	public ExportedOperator {
		outputGenerators = Map.copyOf(outputGenerators);
		imports = Map.copyOf(imports);
	}

	@Override
	public ExportType exportType() {
		return ExportType.OPERATOR;
	}
}
