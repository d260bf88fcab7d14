package org.marionette.compiler.backend.graph;

import org.marionette.compiler.api.Catalog;
import org.marionette.compiler.api.CompilerErrorCode;
import org.marionette.compiler.api.CycleException;
import org.marionette.compiler.api.RelationshipEdge;
import org.marionette.compiler.api.ResourceIdentity;
import org.marionette.compiler.api.ResourceNode;
import org.marionette.compiler.api.SourceInfo;
import org.marionette.compiler.api.UnresolvedReferenceException;
import org.marionette.compiler.diagnostics.CompilerLogger;
import org.marionette.compiler.diagnostics.Diagnostic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Assembles resources and edges into a {@link Catalog} and computes its application order.
 * <p>
 * The order is a topological sort in which ties are broken by declaration index, so the same
 * manifest always yields the same order. If the edges contain a cycle, one witness cycle is
 * extracted deterministically and reported.
 */
public final class GraphBuilder {

    private final String manifestName;

    /**
     * @param manifestName The name of the manifest the catalog is built for.
     */
    public GraphBuilder(String manifestName) {
        this.manifestName = manifestName;
    }

    /**
     * Builds the catalog.
     *
     * @param resources The declared resources, unique by identity.
     * @param edges The relationship edges; duplicates are dropped.
     * @return The validated catalog.
     * @throws UnresolvedReferenceException if an edge names a resource that is not in {@code resources}.
     *         Each diagnostic is positioned at the edge's declared endpoint, or carries
     *         {@link SourceInfo#UNKNOWN} when neither endpoint is declared.
     * @throws CycleException if the edges contain a cycle, including a self-loop.
     */
    public Catalog build(List<ResourceNode> resources, List<RelationshipEdge> edges)
            throws UnresolvedReferenceException, CycleException {
        List<ResourceNode> nodes = new ArrayList<>(resources);
        nodes.sort(Comparator.comparingInt(ResourceNode::declarationIndex));

        Map<ResourceIdentity, Integer> position = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            if (position.put(nodes.get(i).identity(), i) != null) {
                throw new IllegalArgumentException("Resource declared twice: " + nodes.get(i).identity());
            }
        }

        List<RelationshipEdge> uniqueEdges = new ArrayList<>(new LinkedHashSet<>(edges));
        checkClosure(uniqueEdges, nodes, position);

        List<Set<Integer>> successors = new ArrayList<>();
        List<Set<Integer>> predecessors = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            successors.add(new TreeSet<>());
            predecessors.add(new TreeSet<>());
        }
        int[] inDegree = new int[nodes.size()];
        for (RelationshipEdge edge : uniqueEdges) {
            int from = position.get(edge.source());
            int to = position.get(edge.target());
            // ORDER and NOTIFY between the same pair constrain ordering once.
            if (successors.get(from).add(to)) {
                predecessors.get(to).add(from);
                inDegree[to]++;
            }
        }

        // Kahn's algorithm; nodes are indexed by declaration order, so the queue yields the earliest ready node.
        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < nodes.size(); i++) {
            if (inDegree[i] == 0) ready.add(i);
        }
        boolean[] placed = new boolean[nodes.size()];
        List<ResourceNode> order = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            int next = ready.poll();
            placed[next] = true;
            order.add(nodes.get(next));
            for (int successor : successors.get(next)) {
                if (--inDegree[successor] == 0) ready.add(successor);
            }
        }

        if (order.size() < nodes.size()) {
            List<Integer> cycle = witnessCycle(predecessors, placed);
            List<ResourceIdentity> identities = cycle.stream().map(i -> nodes.get(i).identity()).toList();
            String path = identities.stream().map(ResourceIdentity::toString).collect(Collectors.joining(" -> "))
                    + " -> " + identities.get(0);
            throw new CycleException(new Diagnostic(Diagnostic.Type.ERROR, CompilerErrorCode.DEPENDENCY_CYCLE,
                    "Dependency cycle: " + path, nodes.get(cycle.get(0)).source()), identities);
        }

        CompilerLogger.debug("GraphBuilder: " + nodes.size() + " resources, " + uniqueEdges.size() + " edges for " + manifestName);
        return new Catalog(manifestName, nodes, uniqueEdges, order);
    }

    private static void checkClosure(List<RelationshipEdge> edges, List<ResourceNode> nodes,
                                     Map<ResourceIdentity, Integer> position) throws UnresolvedReferenceException {
        List<Diagnostic> errors = new ArrayList<>();
        List<ResourceIdentity> missing = new ArrayList<>();
        for (RelationshipEdge edge : edges) {
            for (ResourceIdentity endpoint : List.of(edge.source(), edge.target())) {
                if (!position.containsKey(endpoint)) {
                    Integer anchor = position.get(endpoint.equals(edge.source()) ? edge.target() : edge.source());
                    SourceInfo at = anchor != null ? nodes.get(anchor).source() : SourceInfo.UNKNOWN;
                    errors.add(new Diagnostic(Diagnostic.Type.ERROR, CompilerErrorCode.UNRESOLVED_REFERENCE,
                            "Edge " + edge + " refers to undeclared resource " + endpoint + ".", at));
                    missing.add(endpoint);
                }
            }
        }
        if (!errors.isEmpty()) {
            throw new UnresolvedReferenceException(errors, missing);
        }
    }

    /**
     * Finds one cycle among the nodes the sort could not place. Starting at the earliest such
     * node, it repeatedly steps to the earliest unplaced predecessor until a node repeats.
     * Every unplaced node has an unplaced predecessor, so the walk always closes a cycle.
     *
     * @return The cycle in edge direction, starting with its earliest declared node.
     */
    private static List<Integer> witnessCycle(List<Set<Integer>> predecessors, boolean[] placed) {
        int start = 0;
        while (placed[start]) start++;

        Map<Integer, Integer> seenAt = new HashMap<>();
        List<Integer> walk = new ArrayList<>();
        int current = start;
        while (!seenAt.containsKey(current)) {
            seenAt.put(current, walk.size());
            walk.add(current);
            int from = current;
            current = predecessors.get(from).stream()
                    .filter(p -> !placed[p])
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("Unplaced node without unplaced predecessor: " + from));
        }

        List<Integer> cycle = new ArrayList<>(walk.subList(seenAt.get(current), walk.size()));
        Collections.reverse(cycle);
        int earliest = cycle.indexOf(Collections.min(cycle));
        Collections.rotate(cycle, -earliest);
        return cycle;
    }
}
