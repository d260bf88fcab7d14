package org.marionette.compiler.frontend.lexer;

import org.marionette.compiler.api.InterpolatedString;
import org.marionette.compiler.api.StringSegment;

import java.util.ArrayList;
import java.util.List;

/**
 * Decomposes string tokens into ordered literal and reference segments.
 * Segments are never merged and nothing is evaluated.
 */
public final class InterpolationSplitter {

    private InterpolationSplitter() {}

    /**
     * Splits the value of a string token.
     * @param token A token of type {@link TokenType#STRING}.
     * @return The segments of the string.
     * @throws IllegalArgumentException if the token is not a string.
     */
    public static InterpolatedString split(Token token) {
        if (token.type() != TokenType.STRING || !(token.value() instanceof StringLiteral literal)) {
            throw new IllegalArgumentException("Not a string token: " + token);
        }
        return split(literal);
    }

    /**
     * Splits a string literal.
     * @param literal The literal produced by the lexer.
     * @return The segments; a string without spans yields exactly one literal segment.
     */
    public static InterpolatedString split(StringLiteral literal) {
        if (!literal.interpolating()) {
            return InterpolatedString.literal(literal.content());
        }
        String content = literal.content();
        if (literal.spans().isEmpty()) {
            return InterpolatedString.literal(unescape(content));
        }

        List<StringSegment> segments = new ArrayList<>();
        int pos = 0;
        for (InterpolationSpan span : literal.spans()) {
            if (span.start() > pos) {
                segments.add(new StringSegment.Literal(unescape(content.substring(pos, span.start()))));
            }
            segments.add(new StringSegment.Reference(span.expression()));
            pos = span.end();
        }
        if (pos < content.length()) {
            segments.add(new StringSegment.Literal(unescape(content.substring(pos))));
        }
        return new InterpolatedString(segments);
    }

    /**
     * Processes the escape sequences of double-quoted text. Unknown escapes keep their backslash.
     * @param raw The raw text.
     * @return The processed text.
     */
    static String unescape(String raw) {
        if (raw.indexOf('\\') < 0) {
            return raw;
        }
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c != '\\' || i + 1 >= raw.length()) {
                sb.append(c);
                continue;
            }
            char next = raw.charAt(++i);
            switch (next) {
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 's' -> sb.append(' ');
                case '\\', '"', '\'', '$' -> sb.append(next);
                default -> sb.append('\\').append(next);
            }
        }
        return sb.toString();
    }
}
