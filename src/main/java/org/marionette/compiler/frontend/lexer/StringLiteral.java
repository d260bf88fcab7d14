package org.marionette.compiler.frontend.lexer;

import java.util.List;

/**
 * The value of a {@link TokenType#STRING} token.
 *
 * @param content For double-quoted strings the raw text between the quotes with escapes unprocessed;
 *                for single-quoted strings the text with its escapes already processed.
 * @param interpolating {@code true} for double-quoted strings.
 * @param spans The interpolation spans in {@code content}, in order. Always empty for single-quoted strings.
 */
public record StringLiteral(String content, boolean interpolating, List<InterpolationSpan> spans) {

    public StringLiteral {
        spans = List.copyOf(spans);
    }
}
