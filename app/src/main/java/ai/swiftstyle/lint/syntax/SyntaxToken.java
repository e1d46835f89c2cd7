package ai.swiftstyle.lint.syntax;

import java.util.Objects;

/**
 * A classified token covering the character range {@code [offset, offset + length)}.
 */
public record SyntaxToken(SyntaxKind kind, int offset, int length) {

    public SyntaxToken {
        Objects.requireNonNull(kind, "kind");
        if (offset < 0 || length <= 0) {
            throw new IllegalArgumentException("Invalid token range");
        }
    }

    public int end() {
        return offset + length;
    }

    public boolean contains(int charOffset) {
        return charOffset >= offset && charOffset < end();
    }
}
