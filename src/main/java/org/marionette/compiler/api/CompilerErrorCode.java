package org.marionette.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during compilation.
 * This decouples the test logic from the wording of the error messages.
 */
public enum CompilerErrorCode {
    // region Lexer Errors
    /** A character that cannot start any token. */
    UNEXPECTED_CHARACTER,
    /** A quoted string was not closed before the end of the source. */
    UNTERMINATED_STRING,
    /** A block comment was not closed before the end of the source. */
    UNTERMINATED_COMMENT,
    /** A {@code ${...}} span inside a string was not closed. */
    UNTERMINATED_INTERPOLATION,
    /** A {@code ${}} span without an expression. */
    EMPTY_INTERPOLATION,
    // endregion

    // region Parser Errors
    /** A resource body without a title. */
    MISSING_TITLE,
    /** A resource title that is not followed by ':'. */
    MISSING_COLON,
    /** A resource declaration that is not closed with '}'. */
    MISSING_CLOSING_BRACE,
    /** An attribute that is not of the form {@code name => value}. */
    INVALID_ATTRIBUTE,
    /** The same attribute name appears twice in one resource body. */
    DUPLICATE_ATTRIBUTE,
    /** A relationship operand that is neither a reference nor an array of references. */
    INVALID_RELATIONSHIP_OPERAND,
    /** A malformed resource reference such as {@code File[abc]} with an unquoted title. */
    INVALID_REFERENCE,
    /** A token sequence that cannot be reduced to any statement. */
    UNEXPECTED_TOKEN,
    // endregion

    // region Semantic Errors
    /** The same (type, title) pair is declared twice. */
    DUPLICATE_RESOURCE,
    /** A relationship names a resource that is never declared. */
    UNRESOLVED_REFERENCE,
    /** A relationship metaparameter whose value is not a resource reference (warning). */
    INVALID_METAPARAMETER_VALUE,
    // endregion

    // region Graph Errors
    /** The relationship graph contains a cycle. */
    DEPENDENCY_CYCLE
    // endregion
}
