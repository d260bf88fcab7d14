package org.marionette.compiler.frontend.semantics;

import org.marionette.compiler.api.AttributeValue;
import org.marionette.compiler.api.CompilerErrorCode;
import org.marionette.compiler.api.NodeId;
import org.marionette.compiler.api.ResourceIdentity;
import org.marionette.compiler.api.ResourceNode;
import org.marionette.compiler.api.SourceInfo;
import org.marionette.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds every resource declared in one manifest, keyed by canonical identity.
 * <p>
 * A registry belongs to exactly one compilation and is passed explicitly to the phases that
 * need it; there is no shared or static state. All declarations are registered before any
 * relationship is resolved, so forward references resolve.
 */
public class ResourceRegistry {

    private final DiagnosticsEngine diagnostics;
    private final List<ResourceNode> nodes = new ArrayList<>();
    private final Map<ResourceIdentity, NodeId> index = new HashMap<>();

    /**
     * Constructs an empty registry.
     * @param diagnostics The diagnostics engine for reporting duplicate declarations.
     */
    public ResourceRegistry(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Declares a resource. Reports {@link CompilerErrorCode#DUPLICATE_RESOURCE} if the identity
     * is already declared; the first declaration is kept.
     *
     * @param identity The canonical identity.
     * @param attributes The attributes in declaration order.
     * @param declarationIndex The parser-assigned declaration index.
     * @param source The position of the declaration.
     * @return The id of the new node, or empty if the identity was a duplicate.
     */
    public Optional<NodeId> declare(ResourceIdentity identity, Map<String, AttributeValue> attributes,
                                    int declarationIndex, SourceInfo source) {
        NodeId existing = index.get(identity);
        if (existing != null) {
            ResourceNode first = nodes.get(existing.index());
            diagnostics.reportError(CompilerErrorCode.DUPLICATE_RESOURCE,
                    "Duplicate declaration: " + identity + " is already declared at " + first.source() + ".",
                    source);
            return Optional.empty();
        }
        NodeId id = new NodeId(nodes.size());
        nodes.add(new ResourceNode(identity, attributes, declarationIndex, source));
        index.put(identity, id);
        return Optional.of(id);
    }

    /**
     * Looks up a declared resource.
     * @param identity The canonical identity.
     * @return The node id, or empty if the identity was never declared.
     */
    public Optional<NodeId> lookup(ResourceIdentity identity) {
        return Optional.ofNullable(index.get(identity));
    }

    /**
     * @param id A node id returned by this registry.
     * @return The node.
     */
    public ResourceNode node(NodeId id) {
        return nodes.get(id.index());
    }

    /**
     * @return All declared nodes in declaration order.
     */
    public List<ResourceNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    /**
     * @return The number of declared resources.
     */
    public int size() {
        return nodes.size();
    }
}
