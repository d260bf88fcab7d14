package org.marionette.compiler.e2e;

import org.marionette.compiler.Compiler;
import org.marionette.compiler.api.Catalog;
import org.marionette.compiler.api.CompilationException;
import org.marionette.compiler.api.CompilerErrorCode;
import org.marionette.compiler.api.CycleException;
import org.marionette.compiler.api.DuplicateResourceException;
import org.marionette.compiler.api.EdgeKind;
import org.marionette.compiler.api.LexException;
import org.marionette.compiler.api.ParseException;
import org.marionette.compiler.api.RelationshipEdge;
import org.marionette.compiler.api.ResourceIdentity;
import org.marionette.compiler.api.ResourceNode;
import org.marionette.compiler.api.UnresolvedReferenceException;
import org.marionette.compiler.diagnostics.Diagnostic;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains end-to-end tests for the {@link Compiler}.
 * These tests compile manifests from in-memory strings or test resources and verify the catalog,
 * or the phase-specific exception and its diagnostics.
 */
public class CompilerEndToEndTest {

	private static Catalog compile(String source) throws CompilationException {
		List<String> lines = Arrays.asList(source.split("\\r?\\n"));
		return new Compiler().compile(lines, "e2e.pp");
	}

	private static List<String> references(List<ResourceNode> nodes) {
		return nodes.stream().map(n -> n.identity().toReference()).toList();
	}

	/**
	 * Compiles the sample site manifest and checks resources, edges and the application order.
	 *
	 * @throws Exception if compilation fails.
	 */
	@Test
	@Tag("unit")
	void compilesSampleSiteManifest() throws Exception {
		Catalog catalog = new Compiler().compile(Path.of(getClass().getResource("/manifests/site.pp").toURI()));

		assertThat(catalog.resources()).hasSize(8);
		assertThat(catalog.edges()).hasSize(7);
		assertThat(references(catalog.topologicalOrder())).containsExactly(
				"File['/tmp/one']",
				"File['/tmp/two']",
				"File['/tmp/two/three']",
				"File['/tmp/two/four']",
				"Service['ssh']",
				"Service['nginx']",
				"Exec[\"/root/${scripts}/yo.sh\"]",
				"Foo::Bar['baz']");
		assertThat(catalog.edges()).contains(
				new RelationshipEdge(ResourceIdentity.of("file", "/tmp/two"), ResourceIdentity.of("service", "ssh"), EdgeKind.ORDER),
				new RelationshipEdge(ResourceIdentity.of("file", "/tmp/two/four"), ResourceIdentity.of("service", "nginx"), EdgeKind.NOTIFY));
		assertThat(catalog.notifyTargets(ResourceIdentity.of("file", "/tmp/one")))
				.containsExactly(ResourceIdentity.of("service", "ssh"));
	}

	/**
	 * Verifies that every edge endpoint is a catalog resource and every edge is respected by the order.
	 *
	 * @throws Exception if compilation fails.
	 */
	@Test
	@Tag("unit")
	void catalogIsClosedAndOrdered() throws Exception {
		Catalog catalog = new Compiler().compile(Path.of(getClass().getResource("/manifests/site.pp").toURI()));

		List<String> order = references(catalog.topologicalOrder());
		for (RelationshipEdge edge : catalog.edges()) {
			assertThat(catalog.resource(edge.source())).isPresent();
			assertThat(catalog.resource(edge.target())).isPresent();
			assertThat(order.indexOf(edge.source().toReference())).isLessThan(order.indexOf(edge.target().toReference()));
		}
	}

	/**
	 * Verifies that compiling the same manifest twice yields identical orders.
	 *
	 * @throws Exception if compilation fails.
	 */
	@Test
	@Tag("unit")
	void compilationIsDeterministic() throws Exception {
		String source = String.join("\n",
				"service { 'c': ; 'b': ; 'a': }",
				"[Service['c'], Service['b']] -> Service['a']");

		assertThat(references(compile(source).topologicalOrder()))
				.isEqualTo(references(compile(source).topologicalOrder()))
				.containsExactly("Service['c']", "Service['b']", "Service['a']");
	}

	/**
	 * Verifies that concurrent compilations on one compiler instance do not interfere.
	 *
	 * @throws Exception if a compilation fails.
	 */
	@Test
	@Tag("unit")
	void compilerCanBeSharedBetweenThreads() throws Exception {
		Compiler compiler = new Compiler();
		ExecutorService pool = Executors.newFixedThreadPool(4);
		try {
			List<Future<Catalog>> results = new java.util.ArrayList<>();
			for (int i = 0; i < 8; i++) {
				String name = "m" + i + ".pp";
				String source = "service { 's" + i + "': }\nfile { 'f': }\nFile['f'] -> Service['s" + i + "']";
				results.add(pool.submit(() -> compiler.compile(List.of(source.split("\n")), name)));
			}
			for (int i = 0; i < results.size(); i++) {
				Catalog catalog = results.get(i).get();
				assertThat(catalog.manifestName()).isEqualTo("m" + i + ".pp");
				assertThat(references(catalog.topologicalOrder())).containsExactly("File['f']", "Service['s" + i + "']");
			}
		} finally {
			pool.shutdownNow();
		}
	}

	/**
	 * Verifies that lexical errors stop compilation with a {@link LexException}.
	 */
	@Test
	@Tag("unit")
	void lexicalErrorsRaiseLexException() {
		assertThatThrownBy(() -> compile("file { 'a': owner => @root }\nexec { \"${}\": }"))
				.isInstanceOfSatisfying(LexException.class, e -> {
					assertThat(e.getDiagnostics()).extracting(Diagnostic::code).containsExactly(
							CompilerErrorCode.UNEXPECTED_CHARACTER, CompilerErrorCode.EMPTY_INTERPOLATION);
					assertThat(e.getSourceInfo().toString()).isEqualTo("e2e.pp:1:22");
				});
	}

	/**
	 * Verifies that syntax errors stop compilation with a {@link ParseException}.
	 */
	@Test
	@Tag("unit")
	void syntaxErrorsRaiseParseException() {
		assertThatThrownBy(() -> compile("file { 'a' }"))
				.isInstanceOf(ParseException.class)
				.hasMessageContaining("Expected ':'");
	}

	/**
	 * Verifies that declaring the same resource twice, with different type capitalization,
	 * raises a {@link DuplicateResourceException}.
	 */
	@Test
	@Tag("unit")
	void duplicateDeclarationsRaiseDuplicateResourceException() {
		assertThatThrownBy(() -> compile("foo::bar { 'baz': }\nFoo::Bar { 'baz': }"))
				.isInstanceOfSatisfying(DuplicateResourceException.class, e -> {
					assertThat(e.getDiagnostics()).hasSize(1);
					assertThat(e.getSourceInfo().lineNumber()).isEqualTo(2);
				});
	}

	/**
	 * Verifies that a reference to an undeclared resource raises an {@link UnresolvedReferenceException}.
	 */
	@Test
	@Tag("unit")
	void undeclaredReferenceRaisesUnresolvedReferenceException() {
		String source = "service { 'ssh': }\nService['missing'] -> Service['ssh']";

		assertThatThrownBy(() -> compile(source))
				.isInstanceOfSatisfying(UnresolvedReferenceException.class, e ->
						assertThat(e.getReferences()).containsExactly(ResourceIdentity.of("service", "missing")));
	}

	/**
	 * Verifies that a two-node cycle raises a {@link CycleException} naming both resources.
	 *
	 * @throws Exception if the test resource cannot be located.
	 */
	@Test
	@Tag("unit")
	void cycleRaisesCycleException() throws Exception {
		Path manifest = Path.of(getClass().getResource("/manifests/cycle.pp").toURI());

		assertThatThrownBy(() -> new Compiler().compile(manifest))
				.isInstanceOfSatisfying(CycleException.class, e ->
						assertThat(e.getCycle()).containsExactly(
								ResourceIdentity.of("service", "a"), ResourceIdentity.of("service", "b")));
	}

	/**
	 * Verifies that a manifest with only comments compiles to an empty catalog.
	 *
	 * @throws Exception if compilation fails.
	 */
	@Test
	@Tag("unit")
	void emptyManifestYieldsEmptyCatalog() throws Exception {
		Catalog catalog = compile("# nothing here\n/* at all */");

		assertThat(catalog.resources()).isEmpty();
		assertThat(catalog.edges()).isEmpty();
		assertThat(catalog.topologicalOrder()).isEmpty();
	}
}
