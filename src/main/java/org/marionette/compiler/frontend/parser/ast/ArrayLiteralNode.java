package org.marionette.compiler.frontend.parser.ast;

import org.marionette.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * An AST node that represents a bracketed array of values.
 *
 * @param openBracket The '[' token.
 * @param elements The elements in source order.
 */
public record ArrayLiteralNode(Token openBracket, List<ValueNode> elements) implements ValueNode {

    public ArrayLiteralNode {
        elements = List.copyOf(elements);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(elements);
    }
}
