package org.marionette.compiler.backend.graph;

import org.marionette.compiler.api.Catalog;
import org.marionette.compiler.api.CompilerErrorCode;
import org.marionette.compiler.api.CycleException;
import org.marionette.compiler.api.EdgeKind;
import org.marionette.compiler.api.RelationshipEdge;
import org.marionette.compiler.api.ResourceIdentity;
import org.marionette.compiler.api.ResourceNode;
import org.marionette.compiler.api.SourceInfo;
import org.marionette.compiler.api.UnresolvedReferenceException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link GraphBuilder}: ordering, tie-breaking, de-duplication,
 * closure checking and cycle witnesses.
 */
public class GraphBuilderTest {

    private static ResourceIdentity svc(String title) {
        return ResourceIdentity.of("service", title);
    }

    private static List<ResourceNode> nodes(String... titles) {
        List<ResourceNode> nodes = new ArrayList<>();
        for (int i = 0; i < titles.length; i++) {
            nodes.add(new ResourceNode(svc(titles[i]), Map.of(), i, new SourceInfo("test.pp", i + 1, 1)));
        }
        return nodes;
    }

    private static RelationshipEdge order(String from, String to) {
        return new RelationshipEdge(svc(from), svc(to), EdgeKind.ORDER);
    }

    private static List<String> titles(List<ResourceNode> order) {
        return order.stream().map(n -> n.identity().title().displayText()).toList();
    }

    /**
     * Verifies that resources without edges are applied in declaration order.
     */
    @Test
    @Tag("unit")
    void testWithoutEdgesOrderIsDeclarationOrder() throws Exception {
        // Arrange
        List<ResourceNode> nodes = nodes("c", "a", "b");

        // Act
        Catalog catalog = new GraphBuilder("test.pp").build(nodes, List.of());

        // Assert
        assertThat(titles(catalog.topologicalOrder())).containsExactly("c", "a", "b");
    }

    /**
     * Verifies that edges are respected and that among ready resources the earliest declared one comes first.
     */
    @Test
    @Tag("unit")
    void testEdgesAreRespectedAndTiesGoToEarliestDeclaration() throws Exception {
        // Arrange: d must come before a; b and c are free
        List<RelationshipEdge> edges = List.of(order("d", "a"));

        // Act
        Catalog catalog = new GraphBuilder("test.pp").build(nodes("a", "b", "c", "d"), edges);

        // Assert
        assertThat(titles(catalog.topologicalOrder())).containsExactly("b", "c", "d", "a");
    }

    /**
     * Verifies that the order is a linear extension of the edges.
     */
    @Test
    @Tag("unit")
    void testEveryEdgeSourcePrecedesItsTarget() throws Exception {
        // Arrange
        List<RelationshipEdge> edges = List.of(order("e", "b"), order("b", "a"), order("d", "c"), order("c", "a"), order("e", "d"));

        // Act
        Catalog catalog = new GraphBuilder("test.pp").build(nodes("a", "b", "c", "d", "e"), edges);

        // Assert
        List<String> order = titles(catalog.topologicalOrder());
        assertThat(order).containsExactly("e", "b", "d", "c", "a");
        for (RelationshipEdge edge : edges) {
            assertThat(order.indexOf(edge.source().title().displayText()))
                    .isLessThan(order.indexOf(edge.target().title().displayText()));
        }
    }

    /**
     * Verifies that identical edges are kept once while order and notify edges between one pair both stay.
     */
    @Test
    @Tag("unit")
    void testDuplicateEdgesAreKeptOnceAndKindsStayDistinct() throws Exception {
        // Arrange
        List<RelationshipEdge> edges = List.of(order("a", "b"), order("a", "b"),
                new RelationshipEdge(svc("a"), svc("b"), EdgeKind.NOTIFY));

        // Act
        Catalog catalog = new GraphBuilder("test.pp").build(nodes("a", "b"), edges);

        // Assert
        assertThat(catalog.edges()).hasSize(2);
        assertThat(catalog.notifyTargets(svc("a"))).containsExactly(svc("b"));
        assertThat(catalog.edgesTo(svc("b"))).hasSize(2);
        assertThat(catalog.edgesFrom(svc("b"))).isEmpty();
    }

    /**
     * Verifies that a two-node cycle is reported with both identities, starting at the earlier declaration.
     */
    @Test
    @Tag("unit")
    void testTwoNodeCycleNamesBothResources() {
        // Arrange
        List<RelationshipEdge> edges = List.of(order("a", "b"), order("b", "a"));

        // Act & Assert
        assertThatThrownBy(() -> new GraphBuilder("test.pp").build(nodes("a", "b"), edges))
                .isInstanceOfSatisfying(CycleException.class, e -> {
                    assertThat(e.getCycle()).containsExactly(svc("a"), svc("b"));
                    assertThat(e.getDiagnostics().get(0).code()).isEqualTo(CompilerErrorCode.DEPENDENCY_CYCLE);
                    assertThat(e.getMessage()).contains("Service['a'] -> Service['b'] -> Service['a']");
                    assertThat(e.getSourceInfo().lineNumber()).isEqualTo(1);
                });
    }

    /**
     * Verifies that the witness cycle follows edge direction and excludes resources outside the cycle.
     */
    @Test
    @Tag("unit")
    void testCycleWitnessFollowsEdgeDirection() {
        // Arrange: x is free, the cycle is b -> d -> c -> b
        List<RelationshipEdge> edges = List.of(order("b", "d"), order("d", "c"), order("c", "b"), order("x", "b"));

        // Act & Assert
        assertThatThrownBy(() -> new GraphBuilder("test.pp").build(nodes("x", "b", "c", "d"), edges))
                .isInstanceOfSatisfying(CycleException.class, e ->
                        assertThat(e.getCycle()).containsExactly(svc("b"), svc("d"), svc("c")));
    }

    /**
     * Verifies that an edge from a resource to itself is a cycle.
     */
    @Test
    @Tag("unit")
    void testSelfLoopIsACycle() {
        // Act & Assert
        assertThatThrownBy(() -> new GraphBuilder("test.pp").build(nodes("a"), List.of(order("a", "a"))))
                .isInstanceOfSatisfying(CycleException.class, e ->
                        assertThat(e.getCycle()).containsExactly(svc("a")));
    }

    /**
     * Verifies that an edge to an undeclared resource is rejected and positioned at its declared endpoint.
     */
    @Test
    @Tag("unit")
    void testEdgesToUnknownResourcesAreRejected() {
        // Arrange: b is declared on line 2
        List<RelationshipEdge> edges = List.of(order("ghost", "b"));

        // Act & Assert
        assertThatThrownBy(() -> new GraphBuilder("test.pp").build(nodes("a", "b"), edges))
                .isInstanceOfSatisfying(UnresolvedReferenceException.class, e -> {
                    assertThat(e.getReferences()).containsExactly(svc("ghost"));
                    assertThat(e.getDiagnostics().get(0).code()).isEqualTo(CompilerErrorCode.UNRESOLVED_REFERENCE);
                    assertThat(e.getSourceInfo()).isEqualTo(new SourceInfo("test.pp", 2, 1));
                });
    }

    /**
     * Verifies that an edge between two undeclared resources is still reported, without a position.
     */
    @Test
    @Tag("unit")
    void testEdgeBetweenUnknownResourcesHasNoPosition() {
        // Act & Assert
        assertThatThrownBy(() -> new GraphBuilder("test.pp").build(nodes("a"), List.of(order("x", "y"))))
                .isInstanceOfSatisfying(UnresolvedReferenceException.class, e -> {
                    assertThat(e.getReferences()).containsExactly(svc("x"), svc("y"));
                    assertThat(e.getSourceInfo()).isEqualTo(SourceInfo.UNKNOWN);
                });
    }
}
