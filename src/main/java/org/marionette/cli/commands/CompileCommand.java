package org.marionette.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.marionette.cli.CommandLineInterface;
import org.marionette.compiler.Compiler;
import org.marionette.compiler.api.Catalog;
import org.marionette.compiler.api.CompilationException;
import org.marionette.compiler.backend.emit.OutputFormat;
import org.marionette.compiler.config.CompilerSettings;
import org.marionette.compiler.diagnostics.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(name = "compile",
        mixinStandardHelpOptions = true,
        description = "Compiles a manifest into a resource catalog and prints it as a plan, DOT graph, JSON or manifest.")
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-f", "--file"}, required = true, description = "The manifest file to compile.")
    private File file;

    @Option(names = "--format", description = "Output format: plan, dot, json or manifest (default: marionette.cli.default-format).")
    private String format;

    @Option(names = {"-o", "--output"}, description = "Write the output to this file instead of stdout.")
    private File output;

    @Option(names = {"-v", "--verbosity"}, description = "Compiler log verbosity, 0 (errors) to 4 (trace).")
    private Integer verbosity;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter err = spec.commandLine().getErr();
        final Config config;
        try {
            config = parent != null ? parent.getConfig() : ConfigFactory.load();
        } catch (ConfigException e) {
            err.println("Failed to load configuration: " + e.getMessage());
            err.flush();
            return 2;
        }

        final OutputFormat outputFormat;
        try {
            outputFormat = OutputFormat.fromName(format != null ? format : config.getString("marionette.cli.default-format"));
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage());
        }

        CompilerSettings settings = CompilerSettings.fromConfig(config);
        if (verbosity != null) {
            settings = settings.withVerbosity(verbosity);
        }

        try {
            final Catalog catalog = new Compiler(settings).compile(file.toPath());
            final String rendered = outputFormat.renderer().render(catalog);
            if (output != null) {
                Files.writeString(output.toPath(), rendered, StandardCharsets.UTF_8);
                log.info("Wrote {} output to {}", outputFormat.name().toLowerCase(Locale.ROOT), output.getAbsolutePath());
            } else {
                final PrintWriter out = spec.commandLine().getOut();
                out.print(rendered);
                out.flush();
            }
            return 0;
        } catch (CompilationException e) {
            log.debug("Compilation of {} failed: {}", file, e.getClass().getSimpleName());
            if (e.getDiagnostics().isEmpty()) {
                err.println(e.getMessage());
            }
            for (Diagnostic diagnostic : e.getDiagnostics()) {
                err.println(diagnostic);
            }
            err.flush();
            return 1;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            err.flush();
            return 2;
        }
    }
}
