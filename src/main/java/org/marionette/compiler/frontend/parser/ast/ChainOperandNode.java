package org.marionette.compiler.frontend.parser.ast;

import java.util.List;

/**
 * One operand of a relationship chain: a single reference or a bracketed array of references.
 */
public sealed interface ChainOperandNode extends AstNode permits ResourceReferenceNode, ReferenceArrayNode {

    /**
     * @return The references this operand stands for, in source order.
     */
    List<ResourceReferenceNode> references();
}
