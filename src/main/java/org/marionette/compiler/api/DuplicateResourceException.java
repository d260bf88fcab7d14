package org.marionette.compiler.api;

import org.marionette.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * Thrown when a manifest contains a (type, title) pair that is declared more than once.
 */
public class DuplicateResourceException extends CompilationException {

    /**
     * @param diagnostics All errors reported by the failing phase.
     */
    public DuplicateResourceException(List<Diagnostic> diagnostics) {
        super(diagnostics);
    }
}
