package org.automatic.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiler-internal logger with integer verbosity levels on top of SLF4J.
 * Levels: 0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE. Messages use SLF4J's {@code {}} placeholders.
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

    private static final Logger logger = LoggerFactory.getLogger("org.automatic.compiler");

    private CompilerLogger() {}

    /**
     * Sets the logging verbosity level, clamped to the known range.
     * @param newLevel The new level to set.
     */
    public static void setLevel(int newLevel) { level = Math.max(ERROR, Math.min(TRACE, newLevel)); }

    /**
     * @return The current verbosity level.
     */
    public static int getLevel() { return level; }

    /**
     * Logs a warning message.
     * @param msg The message pattern.
     * @param args The pattern arguments.
     */
    public static void warn(String msg, Object... args) {
        if (level >= WARN) logger.warn(msg, args);
    }

    /**
     * Logs an informational message.
     * @param msg The message pattern.
     * @param args The pattern arguments.
     */
    public static void info(String msg, Object... args) {
        if (level >= INFO) logger.info(msg, args);
    }

    /**
     * Logs a debug message.
     * @param msg The message pattern.
     * @param args The pattern arguments.
     */
    public static void debug(String msg, Object... args) {
        if (level >= DEBUG) logger.debug(msg, args);
    }

    /**
     * Logs a trace message.
     * @param msg The message pattern.
     * @param args The pattern arguments.
     */
    public static void trace(String msg, Object... args) {
        if (level >= TRACE) logger.trace(msg, args);
    }
}
