package ai.swiftstyle.lint.cli;

import ai.swiftstyle.lint.config.LogFormat;
import ai.swiftstyle.lint.config.Mode;
import ai.swiftstyle.lint.rule.Severity;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "swift-style-lint", mixinStandardHelpOptions = true, version = "swift-style-lint 0.1.0",
        exitCodeOnInvalidInput = CliApplication.EXIT_INVALID_INPUT,
        description = "Reports or removes redundant parentheses around Swift control statement clauses")
public class CliArguments {

    @CommandLine.Option(names = "--mode", converter = ModeConverter.class, description = "Execution mode: lint or fix")
    private Mode mode;

    @CommandLine.Option(names = "--severity", converter = SeverityConverter.class, description = "Severity of reported violations: warning or error")
    private Severity severity;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Parameters(paramLabel = "PATH", arity = "0..*", description = "Files or directories to inspect (default: current directory)")
    private List<Path> paths = new ArrayList<>();

    public Mode mode() {
        return mode;
    }

    public Severity severity() {
        return severity;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public List<Path> paths() {
        return paths;
    }
}
