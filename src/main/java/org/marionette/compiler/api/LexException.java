package org.marionette.compiler.api;

import org.marionette.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * Thrown when a manifest contains malformed tokens: an unterminated string, comment or interpolation, or an invalid character.
 */
public class LexException extends CompilationException {

    /**
     * @param diagnostics All errors reported by the failing phase.
     */
    public LexException(List<Diagnostic> diagnostics) {
        super(diagnostics);
    }
}
