package org.syntaxscript.compiler.backend.export;

/**
 * An exported keyword.
 *
 * @param word The keyword.
 */
public record ExportedKeyword(String word) implements ExportedDescriptor {
	@Override
	public ExportType exportType() {
		return ExportType.KEYWORD;
	}
}
