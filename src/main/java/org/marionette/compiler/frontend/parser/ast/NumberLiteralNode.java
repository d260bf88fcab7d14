package org.marionette.compiler.frontend.parser.ast;

import org.marionette.compiler.frontend.lexer.Token;

/**
 * An AST node that represents a numeric literal.
 *
 * @param token The number token.
 */
public record NumberLiteralNode(Token token) implements ValueNode {
}
