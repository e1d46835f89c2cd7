package ai.swiftstyle.lint.cli;

import ai.swiftstyle.lint.config.Config;
import ai.swiftstyle.lint.config.ConfigLoader;
import ai.swiftstyle.lint.config.SystemEnvironmentReader;
import ai.swiftstyle.lint.lint.LintOutcome;
import ai.swiftstyle.lint.lint.LintRunner;
import ai.swiftstyle.lint.lint.SourceFileCollector;
import ai.swiftstyle.lint.logging.LoggingConfigurator;
import ai.swiftstyle.lint.report.DiagnosticFormatter;
import ai.swiftstyle.lint.rule.controlstatement.ControlStatementRule;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and lint runner.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_SERIOUS_VIOLATIONS = 2;
    static final int EXIT_INVALID_INPUT = 64;

    private final ConfigLoader configLoader;
    private final Path workingDirectory;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), Path.of(""),
                new PrintWriter(System.out, true, StandardCharsets.UTF_8),
                new PrintWriter(System.err, true, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader, Path workingDirectory, PrintWriter out, PrintWriter err) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return EXIT_INVALID_INPUT;
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Running in {} mode (severity={}): paths={}", config.mode(), config.severity().label(), config.paths());

        List<Path> files;
        try {
            files = new SourceFileCollector(workingDirectory, config.fileExtensions(), config.excludedPaths())
                    .collect(config.paths());
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return EXIT_INVALID_INPUT;
        } catch (UncheckedIOException ex) {
            LOGGER.error("Failed to collect source files: {}", ex.getMessage(), ex);
            return EXIT_FAILURE;
        }

        LintRunner runner = new LintRunner(new ControlStatementRule(config.severity()));
        LintOutcome outcome = runner.run(files, config.mode());
        report(outcome);

        if (outcome.hasFailures()) {
            LOGGER.warn("Could not process files: {}", outcome.failedFiles());
            return EXIT_FAILURE;
        }
        if (outcome.hasSeriousViolations()) {
            return EXIT_SERIOUS_VIOLATIONS;
        }
        return EXIT_OK;
    }

    private void report(LintOutcome outcome) {
        DiagnosticFormatter formatter = new DiagnosticFormatter();
        outcome.violations().forEach(violation -> out.println(formatter.format(violation)));
        outcome.corrections().forEach(correction -> out.println(formatter.format(correction)));
        out.flush();
    }
}
