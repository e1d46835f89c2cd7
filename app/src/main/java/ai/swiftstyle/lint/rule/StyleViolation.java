package ai.swiftstyle.lint.rule;

import java.util.Objects;

/**
 * A rule violation found in a file.
 */
public record StyleViolation(RuleDescription rule, Severity severity, Location location) {

    public StyleViolation {
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(location, "location");
    }

    public boolean isSerious() {
        return severity == Severity.ERROR;
    }
}
