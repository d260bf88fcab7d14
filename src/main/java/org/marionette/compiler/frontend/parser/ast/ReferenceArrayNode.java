package org.marionette.compiler.frontend.parser.ast;

import org.marionette.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * An AST node that represents a bracketed array of references used as a chain operand.
 * The references do not need to share a type.
 *
 * @param openBracket The '[' token.
 * @param references The references in source order.
 */
public record ReferenceArrayNode(Token openBracket, List<ResourceReferenceNode> references) implements ChainOperandNode {

    public ReferenceArrayNode {
        references = List.copyOf(references);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(references);
    }
}
