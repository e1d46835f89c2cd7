package ai.swiftstyle.lint.rule.controlstatement;

import ai.swiftstyle.lint.syntax.SyntaxMatch;
import java.util.Objects;

/**
 * A textual match of one control keyword's pattern.
 */
public record ClauseMatch(ControlKeyword keyword, SyntaxMatch match) {

    public ClauseMatch {
        Objects.requireNonNull(keyword, "keyword");
        Objects.requireNonNull(match, "match");
    }

    public int offset() {
        return match.offset();
    }

    public int length() {
        return match.length();
    }
}
