package org.marionette.compiler.frontend.semantics;

import org.marionette.compiler.api.EdgeKind;
import org.marionette.compiler.frontend.lexer.TokenType;

import java.util.Arrays;
import java.util.Optional;

/**
 * The four relationship operators and the equivalent relationship metaparameters.
 * A chain {@code Left op Right} and an attribute {@code metaparameter => Right} declared on
 * {@code Left} produce the same edges.
 */
public enum RelationshipOperator {
    /** {@code ->} / {@code before}: left is applied before right. */
    BEFORE(TokenType.BEFORE_ARROW, "before", EdgeKind.ORDER, false),
    /** {@code ~>} / {@code notify}: left is applied before right and refreshes it on change. */
    NOTIFY(TokenType.NOTIFY_ARROW, "notify", EdgeKind.NOTIFY, false),
    /** {@code <-} / {@code require}: right is applied before left. */
    REQUIRE(TokenType.REQUIRE_ARROW, "require", EdgeKind.ORDER, true),
    /** {@code <~} / {@code subscribe}: right is applied before left and refreshes it on change. */
    SUBSCRIBE(TokenType.SUBSCRIBE_ARROW, "subscribe", EdgeKind.NOTIFY, true);

    private final TokenType tokenType;
    private final String metaparameter;
    private final EdgeKind kind;
    private final boolean reversed;

    RelationshipOperator(TokenType tokenType, String metaparameter, EdgeKind kind, boolean reversed) {
        this.tokenType = tokenType;
        this.metaparameter = metaparameter;
        this.kind = kind;
        this.reversed = reversed;
    }

    /** @return The kind of edge produced. */
    public EdgeKind kind() {
        return kind;
    }

    /** @return {@code true} if the edge runs from the right operand to the left one. */
    public boolean reversed() {
        return reversed;
    }

    /** @return The attribute name with the same meaning. */
    public String metaparameter() {
        return metaparameter;
    }

    /**
     * @param type A chain operator token type.
     * @return The operator.
     * @throws IllegalArgumentException if the token type is not a chain operator.
     */
    public static RelationshipOperator fromToken(TokenType type) {
        return Arrays.stream(values())
                .filter(op -> op.tokenType == type)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Not a relationship operator: " + type));
    }

    /**
     * @param attributeName An attribute name.
     * @return The operator if the attribute is a relationship metaparameter.
     */
    public static Optional<RelationshipOperator> fromMetaparameter(String attributeName) {
        return Arrays.stream(values())
                .filter(op -> op.metaparameter.equals(attributeName))
                .findFirst();
    }
}
