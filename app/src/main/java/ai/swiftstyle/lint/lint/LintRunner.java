package ai.swiftstyle.lint.lint;

import ai.swiftstyle.lint.config.Mode;
import ai.swiftstyle.lint.rule.CorrectableRule;
import ai.swiftstyle.lint.rule.Correction;
import ai.swiftstyle.lint.rule.LintFile;
import ai.swiftstyle.lint.rule.StyleViolation;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs a rule over a list of files, one file at a time, either reporting or fixing violations.
 */
public class LintRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(LintRunner.class);
    static final String MDC_FILE = "file";

    private final CorrectableRule rule;
    private final Function<Path, LintFile> fileReader;

    public LintRunner(CorrectableRule rule) {
        this(rule, LintFile::read);
    }

    LintRunner(CorrectableRule rule, Function<Path, LintFile> fileReader) {
        this.rule = Objects.requireNonNull(rule, "rule");
        this.fileReader = Objects.requireNonNull(fileReader, "fileReader");
    }

    public LintOutcome run(List<Path> files, Mode mode) {
        Objects.requireNonNull(mode, "mode");
        if (files == null || files.isEmpty()) {
            LOGGER.info("No source files to inspect");
            return new LintOutcome(0, List.of(), List.of(), List.of());
        }
        List<StyleViolation> violations = new ArrayList<>();
        List<Correction> corrections = new ArrayList<>();
        List<Path> failedFiles = new ArrayList<>();
        for (Path path : files) {
            MDC.put(MDC_FILE, path.toString());
            try {
                LintFile file = fileReader.apply(path);
                if (mode.isFix()) {
                    List<Correction> fileCorrections = rule.correct(file);
                    if (!fileCorrections.isEmpty()) {
                        LOGGER.debug("Applied {} corrections to {}", fileCorrections.size(), path);
                    }
                    corrections.addAll(fileCorrections);
                } else {
                    violations.addAll(rule.validate(file));
                }
            } catch (UncheckedIOException ex) {
                LOGGER.error("Skipping {}: {}", path, ex.getMessage(), ex);
                failedFiles.add(path);
            } finally {
                MDC.remove(MDC_FILE);
            }
        }
        LOGGER.info("Inspected {} files in {} mode: {} violations, {} corrections, {} failures",
                files.size(), mode, violations.size(), corrections.size(), failedFiles.size());
        return new LintOutcome(files.size(), violations, corrections, failedFiles);
    }
}
