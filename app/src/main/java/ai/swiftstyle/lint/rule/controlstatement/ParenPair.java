package ai.swiftstyle.lint.rule.controlstatement;

/**
 * Offsets of an opening parenthesis and the parenthesis closing it.
 */
public record ParenPair(int open, int close) {

    public ParenPair {
        if (open < 0 || close <= open) {
            throw new IllegalArgumentException("close must follow open");
        }
    }
}
