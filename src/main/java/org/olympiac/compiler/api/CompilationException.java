package org.olympiac.compiler.api;

/**
 * An exception that is thrown when a program cannot be compiled at all, for example because
 * its source file cannot be read.
 * <p>
 * Defects in the program itself are never thrown; they are reported as diagnostics in the
 * {@link CompilationResult}.
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
