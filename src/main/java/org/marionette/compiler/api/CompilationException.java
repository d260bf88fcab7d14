package org.marionette.compiler.api;

import org.marionette.compiler.diagnostics.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An exception that is thrown when one or more errors occur during the compilation process.
 * <p>
 * It is part of the public API. The concrete subclass tells which phase failed; the attached
 * diagnostics list every error that phase reported, in reporting order.
 */
public class CompilationException extends Exception {

    private final transient List<Diagnostic> diagnostics;

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     */
    public CompilationException(String message) {
        super(message, null);
        this.diagnostics = List.of();
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(String message, Throwable cause) {
        super(message, cause);
        this.diagnostics = List.of();
    }

    /**
     * Constructs a new compilation exception from the errors of a failed phase.
     * The message is the formatted list of all diagnostics.
     * @param diagnostics The errors that caused the failure, must not be empty.
     */
    public CompilationException(List<Diagnostic> diagnostics) {
        super(format(diagnostics), null);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Returns the diagnostics that caused this exception.
     * @return An unmodifiable list, empty if the exception was not created from diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /**
     * Returns the position of the first reported error.
     * @return The source position, or {@link SourceInfo#UNKNOWN} if none is attached.
     */
    public SourceInfo getSourceInfo() {
        return diagnostics.isEmpty() ? SourceInfo.UNKNOWN : diagnostics.get(0).source();
    }

    private static String format(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining("\n"));
    }
}
