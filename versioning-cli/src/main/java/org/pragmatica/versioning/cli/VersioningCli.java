package org.pragmatica.versioning.cli;

import io.vavr.control.Either;
import org.pragmatica.versioning.config.ConfigLoader;
import org.pragmatica.versioning.config.VersioningConfig;
import org.pragmatica.versioning.error.VersioningError;
import org.pragmatica.versioning.filter.FilterExpression;
import org.pragmatica.versioning.options.VersioningOptions;
import org.pragmatica.versioning.version.Version;
import org.pragmatica.versioning.version.VersionRegistry;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Command-line checks for version lists, filter expressions and configuration files.
 *
 * <p>Usage examples:
 * <pre>
 * versioning evaluate --versions "v1_0_0, v1_1_0, v2_0_0" 'any(min("v2_0_0"), "v1_0")'
 * versioning check --config versioning.toml
 * versioning check --config versioning.toml -o versions=v1,v2 -o parallel=true
 * </pre>
 *
 * <p>Exit code is 0 on success and 1 when parsing, verification or loading fails; the error
 * message goes to standard error.
 */
@Command(name = "versioning",
         mixinStandardHelpOptions = true,
         version = "Versioning 0.1.0",
         description = "Inspect version lists, filter expressions and versioning configuration",
         subcommands = {
                 VersioningCli.EvaluateCommand.class,
                 VersioningCli.CheckCommand.class
         })
public class VersioningCli implements Runnable {
    static final int OK = 0;
    static final int FAILED = 1;

    @Spec
    private CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new VersioningCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // When no subcommand is specified, show help
        spec.commandLine()
            .usage(spec.commandLine()
                       .getOut());
    }

    static int report(CommandSpec spec, Either<VersioningError, String> outcome) {
        var commandLine = spec.commandLine();

        if (outcome.isLeft()) {
            commandLine.getErr()
                       .println(outcome.getLeft()
                                       .message());
            return FAILED;
        }
        commandLine.getOut()
                   .print(outcome.get());
        commandLine.getOut()
                   .flush();
        return OK;
    }

    // ===== Subcommands =====

    @Command(name = "evaluate", description = "Show which versions a filter expression selects")
    static class EvaluateCommand implements Callable<Integer> {
        @Spec
        private CommandSpec spec;

        @Option(names = {"-v", "--versions"},
                required = true,
                description = "Version list, oldest first, e.g. \"v1_0_0, v2_0_0\"")
        private String versions;

        @Parameters(index = "0", description = "Filter expression, e.g. min(\"v2_0_0\")")
        private String expression;

        @Override
        public Integer call() {
            return report(spec,
                          VersioningOptions.parse(versions)
                                           .map(VersioningOptions::registry)
                                           .flatMap(registry -> FilterExpression.parse(expression)
                                                                                .flatMap(filter -> filter.verify(registry))
                                                                                .map(filter -> render(filter, registry))));
        }

        private static String render(FilterExpression filter, VersionRegistry registry) {
            var width = registry.versions()
                                .stream()
                                .mapToInt(version -> version.name()
                                                            .length())
                                .max()
                                .orElse(0);

            return registry.versions()
                           .stream()
                           .map(version -> line(version, width, filter.evaluate(registry, version)))
                           .collect(Collectors.joining());
        }

        private static String line(Version version, int width, boolean selected) {
            return version.name()
                   + " ".repeat(width - version.name()
                                               .length() + 2)
                   + (selected
                      ? "match"
                      : "skip")
                   + System.lineSeparator();
        }
    }

    @Command(name = "check", description = "Load and validate a versioning configuration file")
    static class CheckCommand implements Callable<Integer> {
        @Spec
        private CommandSpec spec;

        @Option(names = {"-c", "--config"}, required = true, description = "Path to the TOML configuration")
        private Path config;

        @Option(names = {"-o", "--override"}, description = "Override a configuration key, e.g. parallel=true")
        private Map<String, String> overrides = new LinkedHashMap<>();

        @Override
        public Integer call() {
            return report(spec,
                          ConfigLoader.loadWithOverrides(config, overrides)
                                      .flatMap(loaded -> loaded.registry()
                                                               .flatMap(registry -> loaded.emitter()
                                                                                          .map(emitter -> describe(loaded,
                                                                                                                   registry)))));
        }

        private static String describe(VersioningConfig config, VersionRegistry registry) {
            var names = registry.versions()
                                .stream()
                                .map(Version::name)
                                .collect(Collectors.joining(", "));

            return "versions:       " + names + System.lineSeparator()
                   + "annotation:     " + config.annotation() + System.lineSeparator()
                   + "features:       " + config.emitOptions()
                                                .features() + System.lineSeparator()
                   + "nest_top_level: " + config.emitOptions()
                                                .nestTopLevel() + System.lineSeparator()
                   + "parallel:       " + config.parallel() + System.lineSeparator();
        }
    }
}
