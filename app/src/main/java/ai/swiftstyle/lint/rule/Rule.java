package ai.swiftstyle.lint.rule;

import java.util.List;

/**
 * A style check run against one file at a time. Implementations hold no per-file state.
 */
public interface Rule {

    RuleDescription description();

    /**
     * Reports violations without touching the file.
     */
    List<StyleViolation> validate(LintFile file);
}
