package org.marionette.compiler.backend.emit;

import org.marionette.compiler.api.AttributeValue;
import org.marionette.compiler.api.Catalog;
import org.marionette.compiler.api.RelationshipEdge;
import org.marionette.compiler.api.ResourceNode;

import java.util.Map;

/**
 * Prints a catalog back as manifest source: one declaration per resource in declaration order,
 * then one single-step chain per edge. Compiling the output yields the same resources and edges.
 */
public class ManifestPrinter implements CatalogRenderer {

    private static final String INDENT = "  ";

    @Override
    public String render(Catalog catalog) {
        StringBuilder sb = new StringBuilder();
        for (ResourceNode node : catalog.resources()) {
            sb.append(node.identity().type().key()).append(" { ")
                    .append(node.identity().title().toSource()).append(':');
            if (node.attributes().isEmpty()) {
                sb.append(" }\n");
                continue;
            }
            sb.append('\n');
            int width = node.attributes().keySet().stream().mapToInt(String::length).max().orElse(0);
            for (Map.Entry<String, AttributeValue> attribute : node.attributes().entrySet()) {
                sb.append(INDENT).append(attribute.getKey())
                        .append(" ".repeat(width - attribute.getKey().length()))
                        .append(" => ").append(attribute.getValue().toSource()).append(",\n");
            }
            sb.append("}\n");
        }
        if (!catalog.edges().isEmpty()) {
            sb.append('\n');
        }
        for (RelationshipEdge edge : catalog.edges()) {
            sb.append(edge).append('\n');
        }
        return sb.toString();
    }
}
