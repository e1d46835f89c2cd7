package ai.swiftstyle.lint.lint;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Expands configured paths to the source files that should be linted.
 */
public class SourceFileCollector {

    private final Path workingDirectory;
    private final Set<String> fileExtensions;
    private final List<String> excludedPaths;

    public SourceFileCollector(Path workingDirectory, Set<String> fileExtensions, List<String> excludedPaths) {
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory").toAbsolutePath().normalize();
        this.fileExtensions = Set.copyOf(Objects.requireNonNull(fileExtensions, "fileExtensions"));
        this.excludedPaths = List.copyOf(Objects.requireNonNull(excludedPaths, "excludedPaths"));
    }

    public List<Path> collect(List<Path> roots) {
        Objects.requireNonNull(roots, "roots");
        Set<Path> files = new LinkedHashSet<>();
        for (Path root : roots) {
            Path resolved = workingDirectory.resolve(root).normalize();
            if (Files.isRegularFile(resolved)) {
                // explicitly named files are linted whatever their extension
                if (!isExcluded(resolved)) {
                    files.add(resolved);
                }
            } else if (Files.isDirectory(resolved)) {
                files.addAll(walk(resolved));
            } else {
                throw new IllegalArgumentException("Path does not exist: " + root);
            }
        }
        return new ArrayList<>(files);
    }

    private List<Path> walk(Path directory) {
        try (Stream<Path> stream = Files.walk(directory)) {
            return stream.filter(Files::isRegularFile)
                    .filter(this::hasLintedExtension)
                    .filter(path -> !isExcluded(path))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list source files under " + directory, ex);
        }
    }

    private boolean hasLintedExtension(Path path) {
        String name = path.getFileName().toString();
        int idx = name.lastIndexOf('.') + 1;
        if (idx <= 0 || idx == name.length()) {
            return false;
        }
        return fileExtensions.contains(name.substring(idx).toLowerCase(Locale.ROOT));
    }

    private boolean isExcluded(Path path) {
        if (excludedPaths.isEmpty()) {
            return false;
        }
        String absolute = path.toString().replace('\\', '/');
        String relative = path.startsWith(workingDirectory)
                ? workingDirectory.relativize(path).toString().replace('\\', '/')
                : absolute;
        for (String excluded : excludedPaths) {
            if (matchesPrefix(relative, excluded) || matchesPrefix(absolute, excluded)) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesPrefix(String path, String prefix) {
        return path.equals(prefix) || path.startsWith(prefix.endsWith("/") ? prefix : prefix + "/");
    }
}
