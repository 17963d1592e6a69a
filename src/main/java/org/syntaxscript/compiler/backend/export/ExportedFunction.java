package org.syntaxscript.compiler.backend.export;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * An exported function.
 *
 * @param name             The function name as called in usage files.
 * @param argumentPatterns The pattern of each argument, in order.
 * @param formatNames      The name calls are renamed to, per target format.
 * @param imports          The module each target format needs, if any.
 */
public record ExportedFunction(
		String name,
		List<String> argumentPatterns,
		Map<String, String> formatNames,
		Map<String, String> imports
) implements ExportedDescriptor {

	public ExportedFunction {
		argumentPatterns = List.copyOf(argumentPatterns);
		formatNames = Map.copyOf(formatNames);
		imports = Map.copyOf(imports);
	}

	/**
	 * @return The pattern matching a call {@code name(arg,arg,...)} without whitespace around the arguments.
	 */
	public Pattern callPattern() {
		return Pattern.compile(Pattern.quote(name) + "\\(" + String.join(",", argumentPatterns) + "\\)");
	}

	@Override
	public ExportType exportType() {
		return ExportType.FUNCTION;
	}
}
