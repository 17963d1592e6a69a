package org.syntaxscript.compiler.frontend.lexer;

/**
 * Selects which kind of file the {@link Lexer} scans.
 */
public enum LexerMode {
    /** A {@code .syx} declaration file, scanned to its end. */
    DECLARATION,
    /** A {@code .sys} usage file, scanned up to the {@code :::} marker. */
    USAGE
}
