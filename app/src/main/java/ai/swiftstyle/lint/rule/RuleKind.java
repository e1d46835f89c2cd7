package ai.swiftstyle.lint.rule;

/**
 * Broad family a rule belongs to.
 */
public enum RuleKind {
    LINT,
    IDIOMATIC,
    STYLE,
    METRICS,
    PERFORMANCE
}
