package ai.swiftstyle.lint.rule;

import ai.swiftstyle.lint.source.SourceBuffer;
import ai.swiftstyle.lint.syntax.SwiftSyntaxService;
import ai.swiftstyle.lint.syntax.SyntaxKind;
import ai.swiftstyle.lint.syntax.SyntaxMatch;
import ai.swiftstyle.lint.syntax.SyntaxQuery;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A source file under lint: its current contents, the syntax facts derived from them and, for
 * files on disk, the path corrections are written back to.
 */
public class LintFile {

    private final Path path;
    private final Function<SourceBuffer, ? extends SyntaxQuery> syntaxFactory;
    private SourceBuffer buffer;
    private SyntaxQuery syntax;
    private RuleRegions regions;

    public LintFile(Path path, String contents, Function<SourceBuffer, ? extends SyntaxQuery> syntaxFactory) {
        this.path = path;
        this.buffer = new SourceBuffer(Objects.requireNonNull(contents, "contents"));
        this.syntaxFactory = Objects.requireNonNull(syntaxFactory, "syntaxFactory");
    }

    public static LintFile read(Path path) {
        Objects.requireNonNull(path, "path");
        try {
            return new LintFile(path, Files.readString(path, StandardCharsets.UTF_8), SwiftSyntaxService::new);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read source file: " + path, ex);
        }
    }

    /**
     * In-memory file; {@link #write(String)} only replaces the contents.
     */
    public static LintFile of(String contents) {
        return new LintFile(null, contents, SwiftSyntaxService::new);
    }

    public Optional<Path> path() {
        return Optional.ofNullable(path);
    }

    public String contents() {
        return buffer.text();
    }

    public SourceBuffer buffer() {
        return buffer;
    }

    public SyntaxQuery syntax() {
        if (syntax == null) {
            syntax = syntaxFactory.apply(buffer);
        }
        return syntax;
    }

    /**
     * Runs {@code pattern} over the whole buffer and pairs each match with the syntax kind found
     * at its first character.
     */
    public List<SyntaxMatch> match(Pattern pattern) {
        Objects.requireNonNull(pattern, "pattern");
        List<SyntaxMatch> matches = new ArrayList<>();
        Matcher matcher = pattern.matcher(buffer.text());
        while (matcher.find()) {
            int start = matcher.start();
            Optional<SyntaxKind> kind = syntax().kindAt(buffer.byteOffset(start));
            matches.add(new SyntaxMatch(start, matcher.end() - start, kind));
        }
        return matches;
    }

    public Location location(int characterOffset) {
        return Location.of(path, buffer, characterOffset);
    }

    public boolean isRuleEnabled(String ruleIdentifier, int characterOffset) {
        if (regions == null) {
            regions = RuleRegions.parse(buffer, syntax());
        }
        return regions.isEnabled(ruleIdentifier, characterOffset);
    }

    /**
     * Replaces the contents and, for files on disk, persists them as UTF-8.
     */
    public void write(String contents) {
        Objects.requireNonNull(contents, "contents");
        if (path != null) {
            try {
                Files.writeString(path, contents, StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to write corrected source file: " + path, ex);
            }
        }
        buffer = new SourceBuffer(contents);
        syntax = null;
        regions = null;
    }
}
