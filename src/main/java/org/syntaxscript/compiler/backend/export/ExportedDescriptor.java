package org.syntaxscript.compiler.backend.export;

/**
 * The compiled, cross-file usable form of an exported declaration.
 */
public sealed interface ExportedDescriptor permits ExportedOperator, ExportedFunction, ExportedKeyword, ExportedGlobal {

	/**
	 * @return The kind of this descriptor.
	 */
	ExportType exportType();
}
