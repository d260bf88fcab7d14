package org.marionette.compiler.api;

/**
 * The kind of a relationship edge. Both kinds constrain ordering.
 */
public enum EdgeKind {
    /** The source must be applied before the target. */
    ORDER("->"),
    /** Like {@link #ORDER}, and a change of the source sends a refresh to the target. */
    NOTIFY("~>");

    private final String operator;

    EdgeKind(String operator) {
        this.operator = operator;
    }

    /**
     * @return The left-to-right chaining operator that produces this kind.
     */
    public String operator() {
        return operator;
    }

    /**
     * @return The lower-case label used in rendered output.
     */
    public String label() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
