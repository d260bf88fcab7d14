package org.marionette.compiler.frontend.lexer;

import org.marionette.compiler.api.SourceInfo;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., identifier, string, operator).
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token (a {@link StringLiteral} for strings, the text for numbers).
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical file name from which this token originates.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {
    /**
     * @return The position of this token.
     */
    public SourceInfo sourceInfo() {
        return new SourceInfo(fileName, line, column);
    }
}
