package org.marionette.compiler.frontend.semantics;

import org.marionette.compiler.api.CompilerErrorCode;
import org.marionette.compiler.api.RelationshipEdge;
import org.marionette.compiler.api.ResourceIdentity;
import org.marionette.compiler.api.TypeName;
import org.marionette.compiler.diagnostics.DiagnosticsEngine;
import org.marionette.compiler.frontend.TreeWalker;
import org.marionette.compiler.frontend.parser.ast.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Second semantic pass: turns relationship chains and relationship metaparameters into edges.
 * <p>
 * Each operator of a chain connects only its two adjacent operands; array operands expand to
 * the cross product of their members. References to undeclared resources are reported once per
 * occurrence and produce no edge. Identical edges are kept once, in first-seen order.
 * Must run after {@link DeclarationCollector} has filled the registry.
 */
public class RelationshipResolver {

    private final ResourceRegistry registry;
    private final DiagnosticsEngine diagnostics;
    private final Set<RelationshipEdge> edges = new LinkedHashSet<>();
    private final List<ResourceIdentity> unresolved = new ArrayList<>();

    /**
     * @param registry The populated registry.
     * @param diagnostics The diagnostics engine for unresolved references and metaparameter warnings.
     */
    public RelationshipResolver(ResourceRegistry registry, DiagnosticsEngine diagnostics) {
        this.registry = registry;
        this.diagnostics = diagnostics;
    }

    /**
     * Resolves all relationships in the given statements.
     * @param statements The top-level AST nodes.
     * @return The de-duplicated edges in resolution order.
     */
    public List<RelationshipEdge> resolve(List<AstNode> statements) {
        Map<Class<? extends AstNode>, Consumer<AstNode>> handlers = new HashMap<>();
        handlers.put(ChainNode.class, node -> resolveChain((ChainNode) node));
        handlers.put(ResourceDeclarationNode.class, node -> resolveMetaparameters((ResourceDeclarationNode) node));
        new TreeWalker(handlers).walk(statements);
        return List.copyOf(edges);
    }

    /**
     * @return Every reference occurrence that could not be resolved, in reporting order.
     */
    public List<ResourceIdentity> getUnresolved() {
        return List.copyOf(unresolved);
    }

    private void resolveChain(ChainNode chain) {
        // Each operand is resolved exactly once, so an unresolved reference is reported once.
        List<List<ResourceIdentity>> operands = new ArrayList<>();
        for (ChainOperandNode operand : chain.operands()) {
            operands.add(resolveReferences(operand.references()));
        }
        for (int i = 0; i < chain.operators().size(); i++) {
            RelationshipOperator operator = RelationshipOperator.fromToken(chain.operators().get(i).type());
            connect(operands.get(i), operands.get(i + 1), operator);
        }
    }

    private void resolveMetaparameters(ResourceDeclarationNode declaration) {
        TypeName type = TypeName.of(declaration.typeToken().text());
        for (ResourceBodyNode body : declaration.bodies()) {
            ResourceIdentity self = new ResourceIdentity(type, body.title());
            for (AttributeNode attribute : body.attributes()) {
                Optional<RelationshipOperator> operator = RelationshipOperator.fromMetaparameter(attribute.name().text());
                if (operator.isPresent()) {
                    List<ResourceReferenceNode> targets = metaparameterTargets(attribute);
                    connect(List.of(self), resolveReferences(targets), operator.get());
                }
            }
        }
    }

    private List<ResourceReferenceNode> metaparameterTargets(AttributeNode attribute) {
        List<ValueNode> values = attribute.value() instanceof ArrayLiteralNode array
                ? array.elements()
                : List.of(attribute.value());
        List<ResourceReferenceNode> references = new ArrayList<>();
        for (ValueNode value : values) {
            if (value instanceof ResourceReferenceNode reference) {
                references.add(reference);
            } else {
                diagnostics.reportWarning(CompilerErrorCode.INVALID_METAPARAMETER_VALUE,
                        "Metaparameter '" + attribute.name().text() + "' expects resource references; ignoring "
                                + DeclarationCollector.toAttributeValue(value).toSource() + ".",
                        attribute.name().sourceInfo());
            }
        }
        return references;
    }

    private List<ResourceIdentity> resolveReferences(List<ResourceReferenceNode> references) {
        List<ResourceIdentity> resolved = new ArrayList<>();
        for (ResourceReferenceNode reference : references) {
            ResourceIdentity identity = reference.identity();
            if (registry.lookup(identity).isPresent()) {
                resolved.add(identity);
            } else {
                diagnostics.reportError(CompilerErrorCode.UNRESOLVED_REFERENCE,
                        "Reference to undeclared resource " + identity + ".", reference.sourceInfo());
                unresolved.add(identity);
            }
        }
        return resolved;
    }

    private void connect(List<ResourceIdentity> left, List<ResourceIdentity> right, RelationshipOperator operator) {
        for (ResourceIdentity l : left) {
            for (ResourceIdentity r : right) {
                edges.add(operator.reversed()
                        ? new RelationshipEdge(r, l, operator.kind())
                        : new RelationshipEdge(l, r, operator.kind()));
            }
        }
    }
}
