package org.marionette.compiler.frontend.parser.ast;

import org.marionette.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * An AST node that represents {@code name => value} inside a resource body.
 *
 * @param name The attribute name token.
 * @param value The value.
 */
public record AttributeNode(Token name, ValueNode value) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }
}
