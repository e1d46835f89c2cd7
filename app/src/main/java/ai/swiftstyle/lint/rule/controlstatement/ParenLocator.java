package ai.swiftstyle.lint.rule.controlstatement;

import java.util.Objects;
import java.util.Optional;

/**
 * Finds the outermost parenthesis pair of a span: its first {@code (} and the {@code )} at which
 * the running depth first returns to zero.
 */
public class ParenLocator {

    /**
     * @return absolute offsets of the pair, or empty when the span holds no {@code (} or the
     *         first one is never closed inside the span
     */
    public Optional<ParenPair> locate(CharSequence text, int offset, int length) {
        Objects.requireNonNull(text, "text");
        int end = Math.min(text.length(), offset + length);
        int open = -1;
        for (int i = Math.max(0, offset); i < end; i++) {
            if (text.charAt(i) == '(') {
                open = i;
                break;
            }
        }
        if (open < 0) {
            return Optional.empty();
        }
        int depth = 0;
        for (int i = open; i < end; i++) {
            char ch = text.charAt(i);
            if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth--;
                if (depth == 0) {
                    return Optional.of(new ParenPair(open, i));
                }
            }
        }
        return Optional.empty();
    }
}
