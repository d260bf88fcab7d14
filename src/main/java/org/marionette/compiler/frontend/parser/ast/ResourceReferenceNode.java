package org.marionette.compiler.frontend.parser.ast;

import org.marionette.compiler.api.InterpolatedString;
import org.marionette.compiler.api.ResourceIdentity;
import org.marionette.compiler.api.SourceInfo;
import org.marionette.compiler.api.TypeName;
import org.marionette.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * An AST node that represents a reference such as {@code File['/tmp/one']}.
 * The type is kept as written; {@link #identity()} canonicalizes it.
 *
 * @param typeToken The type name token.
 * @param titleToken The quoted title token.
 * @param title The title segments.
 */
public record ResourceReferenceNode(Token typeToken, Token titleToken, InterpolatedString title)
        implements ValueNode, ChainOperandNode {

    /**
     * @return The canonical identity this reference points to.
     */
    public ResourceIdentity identity() {
        return new ResourceIdentity(TypeName.of(typeToken.text()), title);
    }

    /**
     * @return The position of the reference.
     */
    public SourceInfo sourceInfo() {
        return typeToken.sourceInfo();
    }

    @Override
    public List<ResourceReferenceNode> references() {
        return List.of(this);
    }
}
