package org.marionette.compiler.backend.emit;

import java.util.Arrays;
import java.util.Locale;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * The output formats a catalog can be rendered in.
 */
public enum OutputFormat {
    /** Numbered application order with outgoing edges. */
    PLAN(PlanPrinter::new),
    /** Graphviz digraph. */
    DOT(DotExporter::new),
    /** Machine-readable JSON document. */
    JSON(CatalogJsonWriter::new),
    /** Canonical manifest source that compiles back to an equivalent catalog. */
    MANIFEST(ManifestPrinter::new);

    private final Supplier<CatalogRenderer> factory;

    OutputFormat(Supplier<CatalogRenderer> factory) {
        this.factory = factory;
    }

    /**
     * @return A new renderer for this format.
     */
    public CatalogRenderer renderer() {
        return factory.get();
    }

    /**
     * Looks up a format by name, ignoring case.
     * @param name The format name, e.g. {@code dot}.
     * @return The format.
     * @throws IllegalArgumentException if no format has that name.
     */
    public static OutputFormat fromName(String name) {
        return Arrays.stream(values())
                .filter(f -> f.name().equalsIgnoreCase(name.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown output format '" + name + "', expected one of "
                        + Arrays.stream(values()).map(f -> f.name().toLowerCase(Locale.ROOT)).collect(Collectors.joining(", "))));
    }
}
