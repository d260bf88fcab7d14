package org.marionette.compiler.api;

import org.marionette.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * Thrown when a manifest contains a token sequence that does not form a valid statement.
 */
public class ParseException extends CompilationException {

    /**
     * @param diagnostics All errors reported by the failing phase.
     */
    public ParseException(List<Diagnostic> diagnostics) {
        super(diagnostics);
    }
}
