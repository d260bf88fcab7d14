package org.marionette.compiler.api;

import org.marionette.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * Thrown when the relationship graph is not acyclic. Carries one witness cycle.
 */
public class CycleException extends CompilationException {

    private final transient List<ResourceIdentity> cycle;

    /**
     * @param diagnostic The error describing the cycle.
     * @param cycle The witness cycle; each element has an edge to the next and the last one back to the first.
     */
    public CycleException(Diagnostic diagnostic, List<ResourceIdentity> cycle) {
        super(List.of(diagnostic));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * @return The witness cycle as an ordered sequence of identities.
     */
    public List<ResourceIdentity> getCycle() {
        return cycle;
    }
}
