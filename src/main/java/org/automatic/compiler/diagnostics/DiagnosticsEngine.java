package org.automatic.compiler.diagnostics;

import org.automatic.compiler.api.CompilerErrorCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An engine for collecting diagnostic messages (errors, warnings)
 * that occur during the compilation process.
 * <p>
 * This decouples error reporting from the actual compiler logic (parser, etc.).
 * The first error ends the compilation: {@link #abort} records it and hands back the
 * exception the reporting phase throws.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Records an error and returns the exception that unwinds the current phase.
     * Callers write {@code throw diagnostics.abort(...)}.
     *
     * @param code       The error code.
     * @param message    The error message.
     * @param fileName   The unit in which the error occurred.
     * @param lineNumber The line number of the error.
     * @return The exception to throw.
     */
    public CompilerAbortException abort(CompilerErrorCode code, String message, String fileName, int lineNumber) {
        Diagnostic error = new Diagnostic(Diagnostic.Type.ERROR, code, message, fileName, lineNumber);
        diagnostics.add(error);
        return new CompilerAbortException(error);
    }

    /**
     * Reports a warning.
     *
     * @param message    The warning message.
     * @param fileName   The unit in which the warning occurred.
     * @param lineNumber The line number of the warning.
     */
    public void reportWarning(String message, String fileName, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, null, message, fileName, lineNumber));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
