package org.marionette.compiler.frontend.lexer;

/**
 * The location of one interpolation inside the raw content of a double-quoted string.
 *
 * @param start Offset of the '$' in the raw content.
 * @param end Offset just past the span (after '}' or the variable name).
 * @param expression The trimmed expression between the braces, or the bare variable name.
 */
public record InterpolationSpan(int start, int end, String expression) {}
