package ai.swiftstyle.lint.rule;

import java.util.Objects;

/**
 * A violation that was fixed in place. The location refers to the text before correction.
 */
public record Correction(RuleDescription rule, Location location) {

    public Correction {
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(location, "location");
    }
}
