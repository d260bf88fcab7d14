package org.marionette.compiler.api;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The validated result of a compilation: every declared resource, every relationship edge and
 * a deterministic application order.
 * <p>
 * Invariants: node identities are unique, every edge endpoint is a declared node, the edges
 * form a DAG, and {@link #topologicalOrder()} places each edge's source before its target.
 * Instances are immutable and safe to share between threads.
 */
public final class Catalog {

    private final String manifestName;
    private final List<ResourceNode> resources;
    private final List<RelationshipEdge> edges;
    private final List<ResourceNode> topologicalOrder;
    private final Map<ResourceIdentity, ResourceNode> byIdentity;

    /**
     * Creates a catalog. Intended for the graph builder, which establishes the invariants.
     *
     * @param manifestName The name of the compiled manifest.
     * @param resources The resources in declaration order.
     * @param edges The de-duplicated edges in resolution order.
     * @param topologicalOrder The resources in application order.
     */
    public Catalog(String manifestName, List<ResourceNode> resources, List<RelationshipEdge> edges,
                   List<ResourceNode> topologicalOrder) {
        this.manifestName = manifestName;
        this.resources = List.copyOf(resources);
        this.edges = List.copyOf(edges);
        this.topologicalOrder = List.copyOf(topologicalOrder);
        Map<ResourceIdentity, ResourceNode> index = new LinkedHashMap<>();
        for (ResourceNode node : this.resources) {
            index.put(node.identity(), node);
        }
        this.byIdentity = index;
    }

    /** @return The name of the compiled manifest. */
    public String manifestName() {
        return manifestName;
    }

    /** @return All resources in declaration order. */
    public List<ResourceNode> resources() {
        return resources;
    }

    /** @return All edges, without duplicates. */
    public List<RelationshipEdge> edges() {
        return edges;
    }

    /** @return All resources in the order they must be applied. */
    public List<ResourceNode> topologicalOrder() {
        return topologicalOrder;
    }

    /**
     * Looks up a resource by identity.
     * @param identity The identity.
     * @return The resource, or empty if it is not part of this catalog.
     */
    public Optional<ResourceNode> resource(ResourceIdentity identity) {
        return Optional.ofNullable(byIdentity.get(identity));
    }

    /**
     * @param identity A resource identity.
     * @return The edges whose source is the given resource.
     */
    public List<RelationshipEdge> edgesFrom(ResourceIdentity identity) {
        return edges.stream().filter(e -> e.source().equals(identity)).toList();
    }

    /**
     * @param identity A resource identity.
     * @return The edges whose target is the given resource.
     */
    public List<RelationshipEdge> edgesTo(ResourceIdentity identity) {
        return edges.stream().filter(e -> e.target().equals(identity)).toList();
    }

    /**
     * @param identity A resource identity.
     * @return The resources that receive a refresh when the given resource changes.
     */
    public List<ResourceIdentity> notifyTargets(ResourceIdentity identity) {
        return edges.stream()
                .filter(e -> e.kind() == EdgeKind.NOTIFY && e.source().equals(identity))
                .map(RelationshipEdge::target)
                .distinct()
                .toList();
    }

    @Override
    public String toString() {
        return "Catalog[" + manifestName + ", " + resources.size() + " resources, " + edges.size() + " edges]";
    }
}
