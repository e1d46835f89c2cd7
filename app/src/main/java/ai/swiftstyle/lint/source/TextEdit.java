package ai.swiftstyle.lint.source;

import java.util.Objects;

/**
 * Replacement of {@code length} characters starting at {@code offset} with {@code replacement}.
 * Offsets refer to the unedited buffer.
 */
public record TextEdit(int offset, int length, String replacement) {

    public TextEdit {
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("Invalid edit range");
        }
        Objects.requireNonNull(replacement, "replacement");
    }

    public static TextEdit delete(int offset) {
        return new TextEdit(offset, 1, "");
    }

    public static TextEdit replace(int offset, String replacement) {
        return new TextEdit(offset, 1, replacement);
    }

    public int end() {
        return offset + length;
    }
}
