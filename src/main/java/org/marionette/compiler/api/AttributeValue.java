package org.marionette.compiler.api;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The value of a resource attribute. Values are stored unevaluated.
 */
public sealed interface AttributeValue
        permits AttributeValue.StringValue, AttributeValue.WordValue, AttributeValue.NumberValue,
                AttributeValue.ArrayValue, AttributeValue.ReferenceValue {

    /**
     * @return The value as it would be written in a manifest.
     */
    String toSource();

    /**
     * A quoted string, possibly with interpolation.
     * @param value The segments.
     */
    record StringValue(InterpolatedString value) implements AttributeValue {
        @Override
        public String toSource() {
            return value.toSource();
        }
    }

    /**
     * A bare word such as {@code running} or {@code directory}.
     * @param word The word.
     */
    record WordValue(String word) implements AttributeValue {
        @Override
        public String toSource() {
            return word;
        }
    }

    /**
     * A numeric literal, kept as written.
     * @param text The literal text.
     */
    record NumberValue(String text) implements AttributeValue {
        @Override
        public String toSource() {
            return text;
        }
    }

    /**
     * An array of values, for attributes that accept several.
     * @param elements The elements in source order.
     */
    record ArrayValue(List<AttributeValue> elements) implements AttributeValue {
        public ArrayValue {
            elements = List.copyOf(elements);
        }

        @Override
        public String toSource() {
            return elements.stream().map(AttributeValue::toSource).collect(Collectors.joining(", ", "[", "]"));
        }
    }

    /**
     * A resource reference such as {@code File['/tmp/one']}.
     * @param identity The referenced identity.
     * @param source Where the reference is written.
     */
    record ReferenceValue(ResourceIdentity identity, SourceInfo source) implements AttributeValue {
        @Override
        public String toSource() {
            return identity.toReference();
        }
    }
}
