package ai.swiftstyle.lint.rule;

import java.util.List;

/**
 * A rule able to rewrite the violations it finds.
 */
public interface CorrectableRule extends Rule {

    /**
     * Fixes violations, persists the corrected contents and returns one correction per violation in
     * document order.
     */
    List<Correction> correct(LintFile file);
}
