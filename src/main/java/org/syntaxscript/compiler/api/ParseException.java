package org.syntaxscript.compiler.api;

import java.util.List;

/**
 * Thrown by the parser on the first grammar violation of a file. There is no error recovery:
 * the whole file is rejected.
 * <p>
 * Some errors carry quick fixes, ranked best first.
 */
public class ParseException extends CompilationException {

    private final List<CodeAction> actions;

    /**
     * Constructs a parse error without quick fixes.
     * @param code    The error code.
     * @param message The detail message.
     * @param range   The offending range, 1-based.
     * @param file    The file being parsed.
     */
    public ParseException(CompilerErrorCode code, String message, SourceRange range, String file) {
        this(code, message, range, file, List.of());
    }

    /**
     * Constructs a parse error with quick fixes.
     * @param code    The error code.
     * @param message The detail message.
     * @param range   The offending range, 1-based.
     * @param file    The file being parsed.
     * @param actions The quick fixes, best first.
     */
    public ParseException(CompilerErrorCode code, String message, SourceRange range, String file, List<CodeAction> actions) {
        super(code, message, range, file);
        this.actions = List.copyOf(actions);
    }

    /**
     * @return The ranked quick fixes, possibly empty.
     */
    public List<CodeAction> getActions() {
        return actions;
    }
}
