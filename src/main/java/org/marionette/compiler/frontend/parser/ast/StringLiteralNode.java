package org.marionette.compiler.frontend.parser.ast;

import org.marionette.compiler.api.InterpolatedString;
import org.marionette.compiler.frontend.lexer.Token;

/**
 * An AST node that represents a quoted string.
 *
 * @param token The string token.
 * @param value The string split into literal and reference segments.
 */
public record StringLiteralNode(Token token, InterpolatedString value) implements ValueNode {
}
