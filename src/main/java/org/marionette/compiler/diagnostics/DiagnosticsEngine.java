package org.marionette.compiler.diagnostics;

import org.marionette.compiler.api.CompilerErrorCode;
import org.marionette.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur during the compilation process.
 * <p>
 * This decouples error reporting from the actual compiler logic (parser, etc.).
 * One instance belongs to exactly one compilation.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code    The error code.
     * @param message The error message.
     * @param source  The position of the error.
     */
    public void reportError(CompilerErrorCode code, String message, SourceInfo source) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message, source));
    }

    /**
     * Reports a warning.
     *
     * @param code    The warning code.
     * @param message The warning message.
     * @param source  The position of the warning.
     */
    public void reportWarning(CompilerErrorCode code, String message, SourceInfo source) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, code, message, source));
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
     * Returns all reported errors in reporting order.
     *
     * @return An unmodifiable list of error diagnostics.
     */
    public List<Diagnostic> errors() {
        return ofType(Diagnostic.Type.ERROR);
    }

    /**
     * Returns all reported warnings in reporting order.
     *
     * @return An unmodifiable list of warning diagnostics.
     */
    public List<Diagnostic> warnings() {
        return ofType(Diagnostic.Type.WARNING);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }

    private List<Diagnostic> ofType(Diagnostic.Type type) {
        return diagnostics.stream().filter(d -> d.type() == type).toList();
    }
}
