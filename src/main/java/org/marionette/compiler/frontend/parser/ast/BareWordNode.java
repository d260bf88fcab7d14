package org.marionette.compiler.frontend.parser.ast;

import org.marionette.compiler.frontend.lexer.Token;

/**
 * An AST node that represents an unquoted word such as {@code running}.
 *
 * @param token The identifier token.
 */
public record BareWordNode(Token token) implements ValueNode {
}
