package org.marionette.compiler.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public interface of the manifest compiler.
 */
public interface ICompiler {

    /**
     * Compiles the given manifest source.
     *
     * @param sourceLines The lines of the manifest.
     * @param manifestName A name for the manifest, used in diagnostics.
     * @return The validated {@link Catalog}.
     * @throws CompilationException if errors occur during the compilation process. The subclass
     *         names the failing phase.
     */
    Catalog compile(List<String> sourceLines, String manifestName) throws CompilationException;

    /**
     * Compiles a UTF-8 manifest file.
     * @param manifestPath The path to the manifest.
     * @return The validated {@link Catalog}.
     * @throws CompilationException if errors occur during compilation.
     * @throws IOException if the file cannot be read.
     */
    default Catalog compile(Path manifestPath) throws CompilationException, IOException {
        return compile(Files.readAllLines(manifestPath, StandardCharsets.UTF_8), manifestPath.toString());
    }
}
