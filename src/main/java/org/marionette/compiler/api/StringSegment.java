package org.marionette.compiler.api;

/**
 * One piece of a quoted string: either literal text or an unevaluated interpolation.
 */
public sealed interface StringSegment permits StringSegment.Literal, StringSegment.Reference {

    /**
     * Literal text with all escape sequences already processed.
     *
     * @param text The text.
     */
    record Literal(String text) implements StringSegment {}

    /**
     * An interpolation such as {@code ${name}} or {@code $name}, left for a later evaluator.
     *
     * @param expression The trimmed text between the braces, or the bare variable name.
     */
    record Reference(String expression) implements StringSegment {}
}
