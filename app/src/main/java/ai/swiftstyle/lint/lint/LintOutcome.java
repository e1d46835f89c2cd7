package ai.swiftstyle.lint.lint;

import ai.swiftstyle.lint.rule.Correction;
import ai.swiftstyle.lint.rule.StyleViolation;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Aggregate of one lint or fix run over a set of files.
 */
public record LintOutcome(int inspectedFiles,
                          List<StyleViolation> violations,
                          List<Correction> corrections,
                          List<Path> failedFiles) {

    public LintOutcome {
        if (inspectedFiles < 0) {
            throw new IllegalArgumentException("inspectedFiles must not be negative");
        }
        violations = List.copyOf(Objects.requireNonNull(violations, "violations"));
        corrections = List.copyOf(Objects.requireNonNull(corrections, "corrections"));
        failedFiles = List.copyOf(Objects.requireNonNull(failedFiles, "failedFiles"));
    }

    public boolean hasSeriousViolations() {
        return violations.stream().anyMatch(StyleViolation::isSerious);
    }

    public boolean hasFailures() {
        return !failedFiles.isEmpty();
    }
}
