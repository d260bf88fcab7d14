package org.marionette.compiler;

import org.marionette.compiler.api.Catalog;
import org.marionette.compiler.api.CompilationException;
import org.marionette.compiler.api.DuplicateResourceException;
import org.marionette.compiler.api.ICompiler;
import org.marionette.compiler.api.LexException;
import org.marionette.compiler.api.ParseException;
import org.marionette.compiler.api.RelationshipEdge;
import org.marionette.compiler.api.UnresolvedReferenceException;
import org.marionette.compiler.backend.graph.GraphBuilder;
import org.marionette.compiler.config.CompilerSettings;
import org.marionette.compiler.diagnostics.CompilerLogger;
import org.marionette.compiler.diagnostics.Diagnostic;
import org.marionette.compiler.diagnostics.DiagnosticsEngine;
import org.marionette.compiler.frontend.lexer.Lexer;
import org.marionette.compiler.frontend.lexer.Token;
import org.marionette.compiler.frontend.parser.Parser;
import org.marionette.compiler.frontend.parser.ast.AstNode;
import org.marionette.compiler.frontend.semantics.DeclarationCollector;
import org.marionette.compiler.frontend.semantics.RelationshipResolver;
import org.marionette.compiler.frontend.semantics.ResourceRegistry;
import org.marionette.compiler.util.DebugDump;

import java.util.List;

/**
 * The main compiler implementation. This class orchestrates the pipeline from manifest source
 * to a {@link Catalog}: lexing, parsing, declaration collection, relationship resolution and
 * graph building. Each phase reports all of its errors before the compiler stops.
 * <p>
 * Every call to {@link #compile(List, String)} uses its own diagnostics and registry, so one
 * instance may compile several manifests, also concurrently.
 */
public class Compiler implements ICompiler {

    private final CompilerSettings settings;

    /**
     * Creates a compiler with the settings from {@code reference.conf}.
     */
    public Compiler() {
        this(CompilerSettings.defaults());
    }

    /**
     * @param settings The compiler settings.
     */
    public Compiler(CompilerSettings settings) {
        this.settings = settings;
    }

    @Override
    public Catalog compile(List<String> sourceLines, String manifestName) throws CompilationException {
        if (settings.verbosity() >= 0) {
            CompilerLogger.setLevel(settings.verbosity());
        }
        CompilerLogger.debug("Compiler: " + manifestName);
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Phase 1: Lexical Analysis
        String fullSource = String.join("\n", sourceLines) + "\n";
        List<Token> tokens = new Lexer(fullSource, diagnostics, manifestName).scanTokens();
        if (diagnostics.hasErrors()) {
            throw new LexException(diagnostics.errors());
        }

        // Phase 2: Parsing (builds AST)
        List<AstNode> ast = new Parser(tokens, diagnostics).parse();
        if (diagnostics.hasErrors()) {
            throw new ParseException(diagnostics.errors());
        }

        // Phase 3: Declarations (all of them, so later references may point forward)
        ResourceRegistry registry = new ResourceRegistry(diagnostics);
        new DeclarationCollector(registry).collect(ast);
        if (diagnostics.hasErrors()) {
            throw new DuplicateResourceException(diagnostics.errors());
        }

        // Phase 4: Relationship resolution
        RelationshipResolver resolver = new RelationshipResolver(registry, diagnostics);
        List<RelationshipEdge> edges = resolver.resolve(ast);
        if (diagnostics.hasErrors()) {
            throw new UnresolvedReferenceException(diagnostics.errors(), resolver.getUnresolved());
        }
        for (Diagnostic warning : diagnostics.warnings()) {
            CompilerLogger.warn(warning.toString());
        }

        // Phase 5: Graph building and ordering
        Catalog catalog = new GraphBuilder(manifestName).build(registry.nodes(), edges);

        CompilerLogger.info("Compiled " + manifestName + ": " + catalog.resources().size()
                + " resources, " + catalog.edges().size() + " edges");
        if (settings.debugDump()) {
            DebugDump.dumpCatalog(settings.dumpDirectory(), catalog);
        }
        return catalog;
    }
}
