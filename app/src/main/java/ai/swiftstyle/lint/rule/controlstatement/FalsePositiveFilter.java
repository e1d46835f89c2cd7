package ai.swiftstyle.lint.rule.controlstatement;

import ai.swiftstyle.lint.rule.LintFile;
import ai.swiftstyle.lint.syntax.StructureKind;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rejects pattern matches that are not redundant clause parentheses.
 */
public class FalsePositiveFilter {

    private static final Logger LOGGER = LoggerFactory.getLogger(FalsePositiveFilter.class);

    public boolean isViolation(ClauseMatch match, LintFile file) {
        Objects.requireNonNull(match, "match");
        Objects.requireNonNull(file, "file");
        String content = file.buffer().substring(match.offset(), match.length());
        if (!match.match().startsWithKeyword()) {
            LOGGER.debug("Ignoring '{}' at {}: not classified as a keyword", match.keyword().spelling(), match.offset());
            return false;
        }
        if (splitsIntoGroups(content)) {
            LOGGER.debug("Ignoring '{}' at {}: clause holds independent parenthesized groups", match.keyword().spelling(), match.offset());
            return false;
        }
        if (isCallExpression(match, file)) {
            LOGGER.debug("Ignoring '{}' at {}: inside a call expression", match.keyword().spelling(), match.offset());
            return false;
        }
        return true;
    }

    /**
     * True when a {@code )} other than the last one closes a group opened at depth one, as in
     * {@code if (a || b) && (c || d)}: the clause is several groups rather than one wrapper.
     */
    static boolean splitsIntoGroups(String content) {
        int lastClose = content.lastIndexOf(')');
        if (lastClose < 0) {
            return false;
        }
        int depth = 0;
        for (int i = 0; i < content.length(); i++) {
            char ch = content.charAt(i);
            if (ch == ')') {
                if (i != lastClose && depth == 1) {
                    return true;
                }
                depth--;
            } else if (ch == '(') {
                depth++;
            }
        }
        return false;
    }

    private boolean isCallExpression(ClauseMatch match, LintFile file) {
        int byteOffset = file.buffer().byteOffset(match.offset());
        List<StructureKind> kinds = file.syntax().structureKindsAt(byteOffset);
        return !kinds.isEmpty() && kinds.get(kinds.size() - 1) == StructureKind.CALL;
    }
}
