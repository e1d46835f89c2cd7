package ai.swiftstyle.lint.rule;

import ai.swiftstyle.lint.source.LineColumn;
import ai.swiftstyle.lint.source.SourceBuffer;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Position of a diagnostic: the file it belongs to, its character offset and its line/column.
 * {@code file} is null for in-memory sources.
 */
public record Location(Path file, int characterOffset, LineColumn position) {

    public Location {
        if (characterOffset < 0) {
            throw new IllegalArgumentException("characterOffset must not be negative");
        }
        Objects.requireNonNull(position, "position");
    }

    public static Location of(Path file, SourceBuffer buffer, int characterOffset) {
        return new Location(file, characterOffset, buffer.locate(characterOffset));
    }

    public Optional<Path> path() {
        return Optional.ofNullable(file);
    }

    public int line() {
        return position.line();
    }

    public int column() {
        return position.column();
    }

    @Override
    public String toString() {
        String prefix = file == null ? "<nopath>" : file.toString();
        return prefix + ":" + position.line() + ":" + position.column();
    }
}
