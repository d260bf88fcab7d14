package org.marionette.compiler.backend.emit;

import org.marionette.compiler.api.Catalog;
import org.marionette.compiler.api.RelationshipEdge;
import org.marionette.compiler.api.ResourceNode;

/**
 * Lists the resources in application order, each followed by its outgoing edges.
 * <pre>
 * # Execution plan for site.pp (2 resources, 1 edges)
 * 1. File['/tmp/one']
 *    ~&gt; Service['ssh']
 * 2. Service['ssh']
 * </pre>
 */
public class PlanPrinter implements CatalogRenderer {

    @Override
    public String render(Catalog catalog) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Execution plan for ").append(catalog.manifestName())
                .append(" (").append(catalog.resources().size()).append(" resources, ")
                .append(catalog.edges().size()).append(" edges)\n");
        int step = 1;
        for (ResourceNode node : catalog.topologicalOrder()) {
            String number = step++ + ". ";
            sb.append(number).append(node.identity()).append('\n');
            for (RelationshipEdge edge : catalog.edgesFrom(node.identity())) {
                sb.append(" ".repeat(number.length()))
                        .append(edge.kind().operator()).append(' ').append(edge.target()).append('\n');
            }
        }
        return sb.toString();
    }
}
