package org.marionette.compiler.frontend.parser.ast;

import org.marionette.compiler.api.InterpolatedString;
import org.marionette.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * An AST node for one titled body of a resource declaration.
 *
 * @param titleToken The title token (a string or a bare word).
 * @param title The title segments.
 * @param attributes The attributes in source order; may be empty.
 * @param declarationIndex Monotonic index of this body within the manifest.
 */
public record ResourceBodyNode(
        Token titleToken,
        InterpolatedString title,
        List<AttributeNode> attributes,
        int declarationIndex
) implements AstNode {

    public ResourceBodyNode {
        attributes = List.copyOf(attributes);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(attributes);
    }
}
