package org.automatic.compiler.diagnostics;

/**
 * Unwinds the running phase after the first error has been recorded.
 * Only thrown by {@link DiagnosticsEngine#abort}; the compiler facade turns it into a
 * {@link org.automatic.compiler.api.CompilationException}.
 */
public class CompilerAbortException extends RuntimeException {

    private final transient Diagnostic diagnostic;

    CompilerAbortException(Diagnostic diagnostic) {
        super(diagnostic.toString());
        this.diagnostic = diagnostic;
    }

    /**
     * @return The error that aborted the phase.
     */
    public Diagnostic diagnostic() {
        return diagnostic;
    }
}
