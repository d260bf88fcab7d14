package org.marionette.compiler.frontend.parser.ast;

/**
 * An attribute value as written in the source.
 */
public sealed interface ValueNode extends AstNode
        permits StringLiteralNode, BareWordNode, NumberLiteralNode, ArrayLiteralNode, ResourceReferenceNode {
}
