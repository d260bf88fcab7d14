package org.marionette.compiler.frontend.lexer;

import org.marionette.compiler.api.InterpolatedString;
import org.marionette.compiler.api.StringSegment;
import org.marionette.compiler.diagnostics.DiagnosticsEngine;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link InterpolationSplitter}.
 * Inputs are scanned by the {@link Lexer} first, so the tests see the same tokens the parser does.
 */
public class InterpolationSplitterTest {

    private static InterpolatedString split(String quoted) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Token token = new Lexer(quoted, diagnostics).scanTokens().get(0);
        assertThat(diagnostics.hasErrors()).as(diagnostics.summary()).isFalse();
        return InterpolationSplitter.split(token);
    }

    /**
     * Verifies that an interpolation in the middle of a string yields literal, reference and literal segments.
     */
    @Test
    @Tag("unit")
    void testSplitsLiteralReferenceLiteral() {
        // Act
        InterpolatedString result = split("\"/root/${scripts}/yo.sh\"");

        // Assert
        assertThat(result.segments()).containsExactly(
                new StringSegment.Literal("/root/"),
                new StringSegment.Reference("scripts"),
                new StringSegment.Literal("/yo.sh"));
        assertThat(result.isInterpolated()).isTrue();
        assertThat(result.displayText()).isEqualTo("/root/${scripts}/yo.sh");
    }

    /**
     * Verifies that adjacent interpolations produce no empty literal between them.
     */
    @Test
    @Tag("unit")
    void testAdjacentReferencesProduceNoEmptyLiterals() {
        // Act
        InterpolatedString result = split("\"${a}${b}\"");

        // Assert
        assertThat(result.segments()).containsExactly(
                new StringSegment.Reference("a"),
                new StringSegment.Reference("b"));
    }

    @Test
    @Tag("unit")
    void testPlainStringsYieldOneLiteral() {
        assertThat(split("\"plain\"").segments()).containsExactly(new StringSegment.Literal("plain"));
        assertThat(split("''").segments()).containsExactly(new StringSegment.Literal(""));
    }

    /**
     * Verifies that interpolation syntax inside single quotes is literal text.
     */
    @Test
    @Tag("unit")
    void testSingleQuotedStringsAreNeverInterpolated() {
        // Act
        InterpolatedString result = split("'no ${interp} here'");

        // Assert
        assertThat(result.isInterpolated()).isFalse();
        assertThat(result.displayText()).isEqualTo("no ${interp} here");
    }

    /**
     * Verifies the unbraced {@code $name} form, including top-scope names.
     */
    @Test
    @Tag("unit")
    void testBareVariablesAndTopScopeNames() {
        // Act
        InterpolatedString result = split("\"$name and $::top::x\"");

        // Assert
        assertThat(result.segments()).containsExactly(
                new StringSegment.Reference("name"),
                new StringSegment.Literal(" and "),
                new StringSegment.Reference("::top::x"));
    }

    /**
     * Verifies that escapes are processed in literal segments and that an escaped dollar does not interpolate.
     */
    @Test
    @Tag("unit")
    void testEscapesAreProcessedInLiteralSegments() {
        // Act
        InterpolatedString result = split("\"tab\\there \\$dollar ${v}\\n\"");

        // Assert
        assertThat(result.segments()).containsExactly(
                new StringSegment.Literal("tab\there $dollar "),
                new StringSegment.Reference("v"),
                new StringSegment.Literal("\n"));
    }

    @Test
    @Tag("unit")
    void testUnknownEscapesKeepTheirBackslash() {
        assertThat(InterpolationSplitter.unescape("C:\\q")).isEqualTo("C:\\q");
        assertThat(InterpolationSplitter.unescape("trailing\\")).isEqualTo("trailing\\");
    }

    @Test
    @Tag("unit")
    void testRejectsNonStringTokens() {
        // Arrange
        Token identifier = new Token(TokenType.IDENTIFIER, "file", null, 1, 1, "test.pp");

        // Act & Assert
        assertThatThrownBy(() -> InterpolationSplitter.split(identifier))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
