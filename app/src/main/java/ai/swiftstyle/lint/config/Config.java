package ai.swiftstyle.lint.config;

import ai.swiftstyle.lint.rule.Severity;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Mode mode,
        Severity severity,
        LogFormat logFormat,
        List<Path> paths,
        Set<String> fileExtensions,
        List<String> excludedPaths
) {

    private static final Set<String> DEFAULT_FILE_EXTENSIONS = Set.of("swift");

    public Config {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(logFormat, "logFormat");
        paths = paths == null || paths.isEmpty() ? List.of(Path.of(".")) : List.copyOf(paths);
        fileExtensions = fileExtensions == null || fileExtensions.isEmpty()
                ? DEFAULT_FILE_EXTENSIONS
                : fileExtensions.stream()
                .map(Config::normalizeExtension)
                .filter(value -> !value.isBlank())
                .collect(Collectors.toUnmodifiableSet());
        excludedPaths = excludedPaths == null
                ? List.of()
                : excludedPaths.stream()
                .map(Config::normalizePath)
                .filter(value -> !value.isBlank())
                .collect(Collectors.toUnmodifiableList());
    }

    private static String normalizePath(String raw) {
        String normalized = raw.replace('\\', '/').trim();
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    private static String normalizeExtension(String raw) {
        String normalized = raw.trim();
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        return normalized.toLowerCase(Locale.ROOT);
    }
}
