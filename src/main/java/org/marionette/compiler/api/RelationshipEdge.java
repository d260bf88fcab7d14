package org.marionette.compiler.api;

/**
 * A directed relationship between two declared resources.
 *
 * @param source The resource applied first.
 * @param target The resource applied afterwards.
 * @param kind The edge kind.
 */
public record RelationshipEdge(ResourceIdentity source, ResourceIdentity target, EdgeKind kind) {

    @Override
    public String toString() {
        return source + " " + kind.operator() + " " + target;
    }
}
