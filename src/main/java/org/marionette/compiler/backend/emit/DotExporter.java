package org.marionette.compiler.backend.emit;

import org.marionette.compiler.api.Catalog;
import org.marionette.compiler.api.EdgeKind;
import org.marionette.compiler.api.RelationshipEdge;
import org.marionette.compiler.api.ResourceNode;

/**
 * Exports the relationship graph in Graphviz DOT syntax. Nodes are listed in application order;
 * notify edges are drawn dashed.
 */
public class DotExporter implements CatalogRenderer {

    @Override
    public String render(Catalog catalog) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph ").append(quote(catalog.manifestName())).append(" {\n");
        sb.append("  rankdir=LR;\n");
        for (ResourceNode node : catalog.topologicalOrder()) {
            sb.append("  ").append(quote(node.identity().toReference())).append(";\n");
        }
        for (RelationshipEdge edge : catalog.edges()) {
            sb.append("  ").append(quote(edge.source().toReference()))
                    .append(" -> ").append(quote(edge.target().toReference()))
                    .append(" [label=").append(quote(edge.kind().label()));
            if (edge.kind() == EdgeKind.NOTIFY) {
                sb.append(", style=dashed");
            }
            sb.append("];\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    static String quote(String id) {
        return '"' + id.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
