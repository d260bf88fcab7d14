package org.marionette.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for {@link CompilerSettings}.
 */
public class CompilerSettingsTest {

    /**
     * Verifies that the defaults match the values shipped in reference.conf.
     */
    @Test
    @Tag("unit")
    void testDefaultsComeFromReferenceConf() {
        // Act
        CompilerSettings settings = CompilerSettings.defaults();

        // Assert
        assertThat(settings.verbosity()).isEqualTo(2);
        assertThat(settings.debugDump()).isFalse();
        assertThat(settings.dumpDirectory()).isEqualTo(Path.of("build/compiler-dumps"));
    }

    /**
     * Verifies that explicit keys override the defaults while missing keys fall back to them.
     */
    @Test
    @Tag("unit")
    void testExplicitValuesOverrideDefaults() {
        // Arrange
        Config config = ConfigFactory.parseString("""
            marionette.compiler {
              verbosity = 4
              debug-dump = true
            }
            """);

        // Act
        CompilerSettings settings = CompilerSettings.fromConfig(config);

        // Assert
        assertThat(settings.verbosity()).isEqualTo(4);
        assertThat(settings.debugDump()).isTrue();
        assertThat(settings.dumpDirectory()).isEqualTo(Path.of("build/compiler-dumps"));
        assertThat(settings.withVerbosity(0).verbosity()).isZero();
    }
}
