package org.marionette.compiler.api;

import java.util.List;

/**
 * A quoted string split into ordered literal and reference segments. Equality is structural,
 * which makes two unevaluated strings equal exactly when they are written the same way.
 *
 * @param segments The segments in source order. A string without interpolation has exactly one literal segment.
 */
public record InterpolatedString(List<StringSegment> segments) {

    public InterpolatedString {
        segments = List.copyOf(segments);
    }

    /**
     * Creates a string consisting of one literal segment.
     * @param text The literal text.
     * @return The string.
     */
    public static InterpolatedString literal(String text) {
        return new InterpolatedString(List.of(new StringSegment.Literal(text)));
    }

    /**
     * @return {@code true} if at least one segment is a reference.
     */
    public boolean isInterpolated() {
        return segments.stream().anyMatch(s -> s instanceof StringSegment.Reference);
    }

    /**
     * Renders the segments as they read unevaluated: literals verbatim, references as {@code ${expr}}.
     * @return The display text.
     */
    public String displayText() {
        StringBuilder sb = new StringBuilder();
        for (StringSegment segment : segments) {
            if (segment instanceof StringSegment.Literal literal) {
                sb.append(literal.text());
            } else if (segment instanceof StringSegment.Reference reference) {
                sb.append("${").append(reference.expression()).append('}');
            }
        }
        return sb.toString();
    }

    /**
     * Renders this string as manifest source that lexes back into the same segments.
     * Plain strings use single quotes, interpolated ones double quotes.
     * @return The quoted source text.
     */
    public String toSource() {
        if (!isInterpolated()) {
            return "'" + escapeSingleQuoted(displayText()) + "'";
        }
        StringBuilder sb = new StringBuilder("\"");
        for (StringSegment segment : segments) {
            if (segment instanceof StringSegment.Literal literal) {
                sb.append(escapeDoubleQuoted(literal.text()));
            } else if (segment instanceof StringSegment.Reference reference) {
                sb.append("${").append(reference.expression()).append('}');
            }
        }
        return sb.append('"').toString();
    }

    private static String escapeSingleQuoted(String text) {
        return text.replace("\\", "\\\\").replace("'", "\\'");
    }

    private static String escapeDoubleQuoted(String text) {
        StringBuilder sb = new StringBuilder();
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '$' -> sb.append("\\$");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return displayText();
    }
}
