package org.marionette.compiler.backend.emit;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.marionette.compiler.api.AttributeValue;
import org.marionette.compiler.api.Catalog;
import org.marionette.compiler.api.InterpolatedString;
import org.marionette.compiler.api.RelationshipEdge;
import org.marionette.compiler.api.ResourceIdentity;
import org.marionette.compiler.api.ResourceNode;
import org.marionette.compiler.api.StringSegment;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Serializes a catalog to pretty-printed JSON with Gson.
 * Titles and string values keep their segments so interpolation stays unevaluated.
 * Numbers are written as JSON numbers when their source text already is one; any other
 * number, such as the file mode {@code 0755}, is written as a string holding its source text.
 */
public class CatalogJsonWriter implements CatalogRenderer {

    private final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    @Override
    public String render(Catalog catalog) {
        return gson.toJson(toJson(catalog)) + "\n";
    }

    /**
     * Builds the JSON tree for a catalog.
     * @param catalog The catalog.
     * @return The JSON object with {@code manifest}, {@code resources}, {@code edges} and {@code order}.
     */
    public JsonObject toJson(Catalog catalog) {
        JsonObject root = new JsonObject();
        root.addProperty("manifest", catalog.manifestName());

        JsonArray resources = new JsonArray();
        for (ResourceNode node : catalog.resources()) {
            JsonObject resource = new JsonObject();
            resource.addProperty("ref", node.identity().toReference());
            resource.addProperty("type", node.identity().type().key());
            resource.add("title", string(node.identity().title()));
            resource.addProperty("index", node.declarationIndex());
            resource.addProperty("source", node.source().toString());
            JsonObject attributes = new JsonObject();
            for (Map.Entry<String, AttributeValue> attribute : node.attributes().entrySet()) {
                attributes.add(attribute.getKey(), value(attribute.getValue()));
            }
            resource.add("attributes", attributes);
            resources.add(resource);
        }
        root.add("resources", resources);

        JsonArray edges = new JsonArray();
        for (RelationshipEdge edge : catalog.edges()) {
            JsonObject e = new JsonObject();
            e.addProperty("source", edge.source().toReference());
            e.addProperty("target", edge.target().toReference());
            e.addProperty("kind", edge.kind().label());
            edges.add(e);
        }
        root.add("edges", edges);

        JsonArray order = new JsonArray();
        catalog.topologicalOrder().stream()
                .map(ResourceNode::identity)
                .map(ResourceIdentity::toReference)
                .forEach(order::add);
        root.add("order", order);
        return root;
    }

    private static JsonElement value(AttributeValue value) {
        if (value instanceof AttributeValue.StringValue s) {
            return string(s.value());
        }
        if (value instanceof AttributeValue.WordValue w) {
            return new JsonPrimitive(w.word());
        }
        if (value instanceof AttributeValue.NumberValue n) {
            return number(n.text());
        }
        if (value instanceof AttributeValue.ArrayValue a) {
            JsonArray array = new JsonArray();
            a.elements().forEach(element -> array.add(value(element)));
            return array;
        }
        AttributeValue.ReferenceValue r = (AttributeValue.ReferenceValue) value;
        JsonObject reference = new JsonObject();
        reference.addProperty("ref", r.identity().toReference());
        return reference;
    }

    /**
     * Leading zeros and signed zeros do not survive a round trip through {@link BigDecimal}, so such text stays a string.
     */
    private static JsonPrimitive number(String text) {
        BigDecimal number = new BigDecimal(text);
        return number.toString().equals(text) ? new JsonPrimitive(number) : new JsonPrimitive(text);
    }

    /**
     * Plain strings become JSON strings; interpolated ones become an array of segment objects.
     */
    private static JsonElement string(InterpolatedString string) {
        if (!string.isInterpolated()) {
            return new JsonPrimitive(string.displayText());
        }
        JsonArray segments = new JsonArray();
        for (StringSegment segment : string.segments()) {
            JsonObject s = new JsonObject();
            if (segment instanceof StringSegment.Literal literal) {
                s.addProperty("literal", literal.text());
            } else if (segment instanceof StringSegment.Reference reference) {
                s.addProperty("interpolate", reference.expression());
            }
            segments.add(s);
        }
        return segments;
    }
}
