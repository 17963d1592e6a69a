package org.syntaxscript.compiler.backend.export;

/**
 * The kinds of descriptors a declaration file can export.
 */
public enum ExportType {
	OPERATOR,
	FUNCTION,
	KEYWORD,
	GLOBAL
}
