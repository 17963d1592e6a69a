package org.syntaxscript.compiler.api;

/**
 * An exception that is thrown when parsing or compiling a file fails.
 * <p>
 * It is part of the public API and aborts work on the current file only. Continuing with other
 * files is the caller's decision.
 */
public class CompilationException extends Exception {

    private final CompilerErrorCode code;
    private final SourceRange range;
    private final String file;

    /**
     * Constructs a new compilation exception that is not tied to a source location.
     * @param code    The error code.
     * @param message The detail message.
     */
    public CompilationException(CompilerErrorCode code, String message) {
        this(code, message, SourceRange.ORIGIN, null);
    }

    /**
     * Constructs a new compilation exception with a cause.
     * @param code    The error code.
     * @param message The detail message.
     * @param cause   The cause.
     */
    public CompilationException(CompilerErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.range = SourceRange.ORIGIN;
        this.file = null;
    }

    /**
     * Constructs a new compilation exception located in a source file.
     * @param code    The error code.
     * @param message The detail message.
     * @param range   The offending range, 1-based.
     * @param file    The file the error occurred in, may be null.
     */
    public CompilationException(CompilerErrorCode code, String message, SourceRange range, String file) {
        super(message, null);
        this.code = code;
        this.range = range;
        this.file = file;
    }

    /**
     * @return The error code.
     */
    public CompilerErrorCode getCode() {
        return code;
    }

    /**
     * @return The offending range, 1-based.
     */
    public SourceRange getRange() {
        return range;
    }

    /**
     * @return The file the error occurred in, or null if unknown.
     */
    public String getFile() {
        return file;
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%s: %s", code, file, range.start(), getMessage());
    }
}
