package org.marionette.compiler.frontend.semantics;

import org.marionette.compiler.api.AttributeValue;
import org.marionette.compiler.api.ResourceIdentity;
import org.marionette.compiler.api.TypeName;
import org.marionette.compiler.frontend.TreeWalker;
import org.marionette.compiler.frontend.parser.ast.*;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * First semantic pass: registers every resource body of every declaration in the
 * {@link ResourceRegistry}, converting attribute value nodes into {@link AttributeValue}s.
 */
public class DeclarationCollector {

    private final ResourceRegistry registry;

    /**
     * @param registry The registry to populate.
     */
    public DeclarationCollector(ResourceRegistry registry) {
        this.registry = registry;
    }

    /**
     * Registers all declarations found in the given statements.
     * @param statements The top-level AST nodes.
     */
    public void collect(List<AstNode> statements) {
        Map<Class<? extends AstNode>, Consumer<AstNode>> handlers = new HashMap<>();
        handlers.put(ResourceDeclarationNode.class, node -> declare((ResourceDeclarationNode) node));
        new TreeWalker(handlers).walk(statements);
    }

    private void declare(ResourceDeclarationNode declaration) {
        TypeName type = TypeName.of(declaration.typeToken().text());
        for (ResourceBodyNode body : declaration.bodies()) {
            Map<String, AttributeValue> attributes = new LinkedHashMap<>();
            for (AttributeNode attribute : body.attributes()) {
                attributes.put(attribute.name().text(), toAttributeValue(attribute.value()));
            }
            registry.declare(new ResourceIdentity(type, body.title()), attributes,
                    body.declarationIndex(), body.titleToken().sourceInfo());
        }
    }

    /**
     * Converts a parsed value into its catalog representation.
     * @param node The value node.
     * @return The attribute value.
     */
    static AttributeValue toAttributeValue(ValueNode node) {
        if (node instanceof StringLiteralNode string) {
            return new AttributeValue.StringValue(string.value());
        }
        if (node instanceof BareWordNode word) {
            return new AttributeValue.WordValue(word.token().text());
        }
        if (node instanceof NumberLiteralNode number) {
            return new AttributeValue.NumberValue(number.token().text());
        }
        if (node instanceof ArrayLiteralNode array) {
            return new AttributeValue.ArrayValue(array.elements().stream()
                    .map(DeclarationCollector::toAttributeValue)
                    .toList());
        }
        if (node instanceof ResourceReferenceNode reference) {
            return new AttributeValue.ReferenceValue(reference.identity(), reference.sourceInfo());
        }
        throw new IllegalStateException("Unsupported value node: " + node);
    }
}
