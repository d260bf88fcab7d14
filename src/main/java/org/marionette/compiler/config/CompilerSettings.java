package org.marionette.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.nio.file.Path;

/**
 * Compiler options read from the {@code marionette.compiler} section of the HOCON configuration.
 * <pre>
 * marionette.compiler {
 *   verbosity = 2                          # 0=ERROR .. 4=TRACE, -1 leaves the logger untouched
 *   debug-dump = false                     # write plan and graph files after each compilation
 *   dump-directory = "build/compiler-dumps"
 * }
 * </pre>
 *
 * @param verbosity The {@link org.marionette.compiler.diagnostics.CompilerLogger} level.
 * @param debugDump Whether to write debug dumps.
 * @param dumpDirectory The root directory for debug dumps.
 */
public record CompilerSettings(int verbosity, boolean debugDump, Path dumpDirectory) {

    private static final String SECTION = "marionette.compiler";

    /**
     * Reads the settings from a configuration. Missing keys fall back to {@code reference.conf}.
     * @param config The application configuration.
     * @return The settings.
     */
    public static CompilerSettings fromConfig(Config config) {
        Config section = config.withFallback(ConfigFactory.defaultReference()).getConfig(SECTION);
        return new CompilerSettings(
                section.getInt("verbosity"),
                section.getBoolean("debug-dump"),
                Path.of(section.getString("dump-directory")));
    }

    /**
     * @return The settings from {@code reference.conf} alone.
     */
    public static CompilerSettings defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }

    /**
     * @param newVerbosity The verbosity to use instead.
     * @return A copy with a different verbosity.
     */
    public CompilerSettings withVerbosity(int newVerbosity) {
        return new CompilerSettings(newVerbosity, debugDump, dumpDirectory);
    }
}
