package org.marionette.compiler.frontend.parser.ast;

import org.marionette.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * An AST node for {@code type { title: attrs; title: attrs }}.
 * Each body declares one resource of the same type.
 *
 * @param typeToken The type name token as written.
 * @param bodies The bodies in source order.
 */
public record ResourceDeclarationNode(Token typeToken, List<ResourceBodyNode> bodies) implements AstNode {

    public ResourceDeclarationNode {
        bodies = List.copyOf(bodies);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(bodies);
    }
}
