package org.marionette.compiler.api;

import org.marionette.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * Thrown when relationships name resources that are never declared.
 * Every offending reference occurrence is reported, not only the first one.
 */
public class UnresolvedReferenceException extends CompilationException {

    private final transient List<ResourceIdentity> references;

    /**
     * @param diagnostics One error per unresolved reference occurrence.
     * @param references The unresolved identities, in reporting order.
     */
    public UnresolvedReferenceException(List<Diagnostic> diagnostics, List<ResourceIdentity> references) {
        super(diagnostics);
        this.references = List.copyOf(references);
    }

    /**
     * @return The identities that could not be resolved, in reporting order.
     */
    public List<ResourceIdentity> getReferences() {
        return references;
    }
}
