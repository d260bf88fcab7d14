package org.marionette.cli;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class CommandLineInterfaceTest {

    @Test
    public void testCliInitialization() {
        CommandLineInterface cli = new CommandLineInterface();
        CommandLine cmd = new CommandLine(cli);
        assertThat(cmd.getCommandName()).isEqualTo("marionette");
        assertThat(cmd.getSubcommands()).containsKeys("compile", "help");
    }

    @Test
    public void testConfigurationIsLoadedFromClasspath() {
        CommandLineInterface cli = new CommandLineInterface();
        assertThat(cli.getConfig().getString("marionette.cli.default-format")).isEqualTo("plan");
        assertThat(cli.getConfig()).isSameAs(cli.getConfig());
    }

    @Test
    public void testMissingConfigFileFailsCompile() {
        CommandLine cmd = new CommandLine(new CommandLineInterface());
        StringWriter err = new StringWriter();
        cmd.setErr(new PrintWriter(err));

        int exitCode = cmd.execute("-c", "does-not-exist.conf", "compile", "-f", "site.pp");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("does-not-exist.conf");
    }
}
