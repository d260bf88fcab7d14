package org.marionette.compiler.frontend.parser.ast;

import org.marionette.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * An AST node for a relationship chain such as {@code A -> [B, C] ~> D}.
 * {@code operators.get(i)} joins {@code operands.get(i)} and {@code operands.get(i + 1)}.
 *
 * @param operands At least two operands.
 * @param operators Exactly one operator fewer than operands.
 */
public record ChainNode(List<ChainOperandNode> operands, List<Token> operators) implements AstNode {

    public ChainNode {
        operands = List.copyOf(operands);
        operators = List.copyOf(operators);
        if (operands.size() != operators.size() + 1) {
            throw new IllegalArgumentException("A chain needs exactly one operator between each pair of operands");
        }
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(operands);
    }
}
