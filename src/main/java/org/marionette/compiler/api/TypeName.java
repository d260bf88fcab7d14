package org.marionette.compiler.api;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The canonical form of a resource type name. Every {@code ::}-separated segment is lower-cased,
 * so {@code foo::bar}, {@code Foo::Bar} and {@code FOO::bar} are the same type.
 * All identity comparisons and lookups go through this key, never through the original spelling.
 *
 * @param key The normalized name, e.g. {@code foo::bar}.
 */
public record TypeName(String key) {

    private static final String SEPARATOR = "::";

    public TypeName {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Type name must not be empty");
        }
    }

    /**
     * Canonicalizes a type name as written in the manifest.
     * @param spelling The type name in any capitalization, e.g. {@code Foo::Bar}.
     * @return The canonical type name.
     */
    public static TypeName of(String spelling) {
        String normalized = Arrays.stream(spelling.split(SEPARATOR, -1))
                .map(segment -> segment.toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(SEPARATOR));
        return new TypeName(normalized);
    }

    /**
     * The capitalized form used in resource references, e.g. {@code Foo::Bar}.
     * @return The reference spelling.
     */
    public String referenceName() {
        return Arrays.stream(key.split(SEPARATOR, -1))
                .map(s -> s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1))
                .collect(Collectors.joining(SEPARATOR));
    }

    @Override
    public String toString() {
        return referenceName();
    }
}
