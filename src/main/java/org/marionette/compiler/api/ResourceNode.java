package org.marionette.compiler.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A declared resource. Immutable once created.
 *
 * @param identity The canonical identity.
 * @param attributes The attributes in declaration order.
 * @param declarationIndex Monotonic index assigned by the parser, used only to break ordering ties.
 * @param source Where the resource title is written.
 */
public record ResourceNode(
        ResourceIdentity identity,
        Map<String, AttributeValue> attributes,
        int declarationIndex,
        SourceInfo source
) {
    public ResourceNode {
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
