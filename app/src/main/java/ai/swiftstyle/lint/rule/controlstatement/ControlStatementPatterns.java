package ai.swiftstyle.lint.rule.controlstatement;

import ai.swiftstyle.lint.rule.LintFile;
import ai.swiftstyle.lint.syntax.SyntaxMatch;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Collects raw matches of every control keyword pattern. The patterns are keyword-anchored, so
 * matches of different keywords never cover the same span and need no deduplication.
 */
public class ControlStatementPatterns {

    public List<ClauseMatch> scan(LintFile file) {
        Objects.requireNonNull(file, "file");
        List<ClauseMatch> matches = new ArrayList<>();
        for (ControlKeyword keyword : ControlKeyword.values()) {
            for (SyntaxMatch match : file.match(keyword.pattern())) {
                matches.add(new ClauseMatch(keyword, match));
            }
        }
        return matches;
    }
}
