package org.syntaxscript.compiler.diagnostics;

import com.fasterxml.jackson.annotation.JsonValue;
import org.syntaxscript.compiler.api.CodeAction;
import org.syntaxscript.compiler.api.SourceRange;

import java.util.List;

/**
 * Represents a single diagnostic message reported for a source file, in the shape
 * editors expect.
 *
 * @param severity The severity of the diagnostic.
 * @param message  The diagnostic message.
 * @param range    The range the diagnostic applies to.
 * @param source   The tool that reported the diagnostic.
 * @param data     The quick fixes offered for the diagnostic.
 */
public record Diagnostic(
        Severity severity,
        String message,
        SourceRange range,
        String source,
        List<CodeAction> data
) {
    /** The source tag of every diagnostic the compiler reports. */
    public static final String SOURCE = "syntax-script";

    /**
     * The severity of a diagnostic, serialized as the numeric code used by language clients.
     */
    public enum Severity {
        /** An error that prevents compilation. */
        ERROR(1),
        /** A warning that does not prevent compilation. */
        WARNING(2);

        private final int code;

        Severity(int code) {
            this.code = code;
        }

        /**
         * @return The numeric severity code.
         */
        @JsonValue
        public int code() {
            return code;
        }
    }

    public Diagnostic {
        data = List.copyOf(data);
    }

    /**
     * @return This diagnostic with its range and every quick fix converted to 0-based coordinates.
     */
    public Diagnostic toZeroBased() {
        return new Diagnostic(severity, message, range.toZeroBased(), source,
                data.stream().map(CodeAction::toZeroBased).toList());
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", severity, range, message);
    }
}
