package org.automatic.compiler.diagnostics;

import org.automatic.compiler.api.CompilerErrorCode;

import java.util.Locale;

/**
 * Represents a single diagnostic message (error or warning)
 * that occurs during the compilation process.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code The error code, or {@code null} for warnings.
 * @param message The diagnostic message.
 * @param fileName The name of the unit where the issue occurred.
 * @param lineNumber The line number of the issue.
 */
public record Diagnostic(
        Type type,
        CompilerErrorCode code,
        String message,
        String fileName,
        int lineNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents compilation. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING
    }

    @Override
    public String toString() {
        if (code == null) {
            return String.format("[%s] %s:%d: %s", type, fileName, lineNumber, message);
        }
        return String.format("[%s] %s:%d: %s error: %s", type, fileName, lineNumber,
                code.kind().name().toLowerCase(Locale.ROOT), message);
    }
}
