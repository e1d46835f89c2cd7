package ai.swiftstyle.lint.config;

import ai.swiftstyle.lint.cli.CliArguments;
import ai.swiftstyle.lint.rule.Severity;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_MODE = "MODE";
    static final String ENV_SEVERITY = "LINT_SEVERITY";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_PATHS = "LINT_PATHS";
    static final String ENV_FILE_EXTENSIONS = "LINT_FILE_EXTENSIONS";
    static final String ENV_EXCLUDED_PATHS = "LINT_EXCLUDED_PATHS";

    private static final Set<String> DEFAULT_FILE_EXTENSIONS = Set.of("swift");

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Mode mode = resolveMode(arguments);
        Severity severity = resolveSeverity(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);
        List<Path> paths = resolvePaths(arguments);

        Set<String> fileExtensions = environmentReader.get(ENV_FILE_EXTENSIONS)
                .filter(ConfigLoader::isNotBlank)
                .map(ConfigLoader::parseFileExtensions)
                .orElse(DEFAULT_FILE_EXTENSIONS);

        List<String> excludedPaths = environmentReader.get(ENV_EXCLUDED_PATHS)
                .filter(ConfigLoader::isNotBlank)
                .map(ConfigLoader::parseList)
                .orElse(List.of());

        return new Config(mode, severity, logFormat, paths, fileExtensions, excludedPaths);
    }

    private Mode resolveMode(CliArguments arguments) {
        Mode cliMode = arguments.mode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.get(ENV_MODE)
                .map(Mode::from)
                .orElse(Mode.LINT);
    }

    private Severity resolveSeverity(CliArguments arguments) {
        Severity cliSeverity = arguments.severity();
        if (cliSeverity != null) {
            return cliSeverity;
        }
        return environmentReader.get(ENV_SEVERITY)
                .filter(ConfigLoader::isNotBlank)
                .map(Severity::from)
                .orElse(Severity.WARNING);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private List<Path> resolvePaths(CliArguments arguments) {
        List<Path> cliPaths = arguments.paths();
        if (cliPaths != null && !cliPaths.isEmpty()) {
            return cliPaths;
        }
        return environmentReader.get(ENV_PATHS)
                .filter(ConfigLoader::isNotBlank)
                .map(ConfigLoader::parseList)
                .map(values -> values.stream().map(Path::of).collect(Collectors.toList()))
                .orElse(List.of(Path.of(".")));
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static List<String> parseList(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .map(value -> value.replace('\\', '/'))
                .collect(Collectors.toList());
    }

    private static Set<String> parseFileExtensions(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .map(value -> value.startsWith(".") ? value.substring(1) : value)
                .map(value -> value.toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
