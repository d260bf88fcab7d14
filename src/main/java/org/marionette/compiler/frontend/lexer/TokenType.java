package org.marionette.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Single-character tokens.
    /** The '{' character, opening a resource body block. */
    LEFT_BRACE,
    /** The '}' character, closing a resource body block. */
    RIGHT_BRACE,
    /** The '[' character, opening an array or a reference title. */
    LEFT_BRACKET,
    /** The ']' character. */
    RIGHT_BRACKET,
    /** The ':' character, separating a title from its attributes. */
    COLON,
    /** The ',' character. */
    COMMA,
    /** The ';' character, separating resource bodies and statements. */
    SEMICOLON,

    // Two-character tokens.
    /** The '=>' operator between attribute name and value. */
    FAT_ARROW,
    /** The '->' chaining operator (left before right). */
    BEFORE_ARROW,
    /** The '~>' chaining operator (left notifies right). */
    NOTIFY_ARROW,
    /** The '&lt;-' chaining operator (left requires right). */
    REQUIRE_ARROW,
    /** The '&lt;~' chaining operator (left subscribes to right). */
    SUBSCRIBE_ARROW,

    // Literals.
    /** A bare word: a type name, attribute name or enumeration value, possibly with '::' segments. */
    IDENTIFIER,
    /** A single- or double-quoted string. Its value is a {@link StringLiteral}. */
    STRING,
    /** A numeric literal. Its value is the literal text. */
    NUMBER,

    // Miscellaneous.
    /** Represents the end of the source file. */
    END_OF_FILE;

    /**
     * @return {@code true} for the four relationship chaining operators.
     */
    public boolean isChainOperator() {
        return this == BEFORE_ARROW || this == NOTIFY_ARROW || this == REQUIRE_ARROW || this == SUBSCRIBE_ARROW;
    }
}
