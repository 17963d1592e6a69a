package org.syntaxscript.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;

/**
 * Compiler-internal logger gated by the integer verbosity of {@link org.syntaxscript.compiler.api.ICompiler#setVerbosity(int)}.
 * Levels: 0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE
 * <p>
 * Every message concerns one source file and is written as {@code <file>: <message>}, with SLF4J
 * {@code {}} placeholders in the message. The SLF4J backend decides where messages end up.
 */
public final class CompilerLogger {

    /** Log level for errors. */
    public static final int ERROR = 0;
    /** Log level for warnings. */
    public static final int WARN  = 1;
    /** Log level for informational messages. */
    public static final int INFO  = 2;
    /** Log level for debug messages. */
    public static final int DEBUG = 3;
    /** Log level for trace messages. */
    public static final int TRACE = 4;
    private static volatile int level = INFO;

    private static final Logger logger = LoggerFactory.getLogger("org.syntaxscript.compiler");

    private CompilerLogger() {}

    /**
     * Sets the verbosity. Values outside 0..4 are clamped.
     * @param verbosity The new verbosity.
     */
    public static void setLevel(int verbosity) { level = Math.max(ERROR, Math.min(TRACE, verbosity)); }

    /**
     * @param messageLevel One of the level constants.
     * @return {@code true} if messages of that level pass the current verbosity.
     */
    public static boolean isEnabled(int messageLevel) {
        return level >= messageLevel;
    }

    public static void warn(String file, String format, Object... args) {
        if (isEnabled(WARN)) logger.warn(render(file, format, args));
    }

    public static void info(String file, String format, Object... args) {
        if (isEnabled(INFO)) logger.info(render(file, format, args));
    }

    public static void debug(String file, String format, Object... args) {
        if (isEnabled(DEBUG)) logger.debug(render(file, format, args));
    }

    public static void trace(String file, String format, Object... args) {
        if (isEnabled(TRACE)) logger.trace(render(file, format, args));
    }

    /**
     * Formats a message the way it is logged.
     * @param file   The file the message concerns.
     * @param format The message with {@code {}} placeholders.
     * @param args   The placeholder values.
     * @return {@code <file>: <formatted message>}.
     */
    static String render(String file, String format, Object... args) {
        return file + ": " + MessageFormatter.arrayFormat(format, args).getMessage();
    }
}
