package org.marionette.compiler.util;

import org.marionette.compiler.api.Catalog;
import org.marionette.compiler.backend.emit.DotExporter;
import org.marionette.compiler.backend.emit.PlanPrinter;
import org.marionette.compiler.diagnostics.CompilerLogger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility class for dumping debug information during compilation.
 */
public final class DebugDump {

	private DebugDump() {}

	/**
	 * Writes the execution plan and the DOT graph of a catalog to {@code <root>/<manifest>/}.
	 * Failures are logged and never fail the compilation.
	 * @param root The dump root directory.
	 * @param catalog The catalog to dump.
	 * @return The directory the files were written to.
	 */
	public static Path dumpCatalog(Path root, Catalog catalog) {
		Path dir = root.resolve(sanitize(catalog.manifestName()));
		try {
			Files.createDirectories(dir);
			Files.writeString(dir.resolve("plan.txt"), new PlanPrinter().render(catalog), StandardCharsets.UTF_8);
			Files.writeString(dir.resolve("graph.dot"), new DotExporter().render(catalog), StandardCharsets.UTF_8);
			CompilerLogger.debug("DebugDump: wrote " + dir);
		} catch (IOException e) {
			CompilerLogger.warn("DebugDump: could not write " + dir + ": " + e.getMessage());
		}
		return dir;
	}

	static String sanitize(String s) { return s.replaceAll("[^A-Za-z0-9_.-]", "_"); }
}
