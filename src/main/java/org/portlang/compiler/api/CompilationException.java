package org.portlang.compiler.api;

/**
 * Thrown when a portfolio source cannot be compiled at all, e.g. because the file could not be read.
 * <p>
 * Problems in the source itself are never reported through this exception; they are
 * {@link org.portlang.compiler.diagnostics.Diagnostic}s in the {@link CompilationResult}.
 */
public class CompilationException extends Exception {

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     */
    public CompilationException(String message) {
        super(message, null);
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
