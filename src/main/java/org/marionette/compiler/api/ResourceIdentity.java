package org.marionette.compiler.api;

/**
 * The identity of a resource: its canonical type and its unevaluated title.
 * Titles containing interpolation are compared syntactically, segment by segment.
 *
 * @param type The canonical type name.
 * @param title The title.
 */
public record ResourceIdentity(TypeName type, InterpolatedString title) {

    /**
     * Convenience factory for plain titles.
     * @param type The type name in any capitalization.
     * @param title The literal title.
     * @return The identity.
     */
    public static ResourceIdentity of(String type, String title) {
        return new ResourceIdentity(TypeName.of(type), InterpolatedString.literal(title));
    }

    /**
     * @return The reference notation, e.g. {@code File['/tmp/one']}.
     */
    public String toReference() {
        return type.referenceName() + "[" + title.toSource() + "]";
    }

    @Override
    public String toString() {
        return toReference();
    }
}
