package org.automatic.compiler.api;

import org.automatic.compiler.diagnostics.Diagnostic;

/**
 * An exception that is thrown when an error aborts the compilation process.
 * <p>
 * It is part of the public API and hides the internal exception types of the compiler.
 */
public class CompilationException extends Exception {

    private final transient Diagnostic diagnostic;

    /**
     * Constructs a new compilation exception for the diagnostic that aborted the compilation.
     * @param diagnostic The error diagnostic.
     */
    public CompilationException(Diagnostic diagnostic) {
        super(diagnostic.toString(), null);
        this.diagnostic = diagnostic;
    }

    /**
     * Constructs a new compilation exception with the specified diagnostic and cause.
     * @param diagnostic The error diagnostic.
     * @param cause The cause.
     */
    public CompilationException(Diagnostic diagnostic, Throwable cause) {
        super(diagnostic.toString(), cause);
        this.diagnostic = diagnostic;
    }

    /**
     * @return The diagnostic that aborted the compilation.
     */
    public Diagnostic diagnostic() {
        return diagnostic;
    }

    /**
     * @return The error code of the aborting diagnostic.
     */
    public CompilerErrorCode code() {
        return diagnostic.code();
    }

    /**
     * @return The stage the aborting error belongs to.
     */
    public ErrorKind kind() {
        return diagnostic.code().kind();
    }
}
