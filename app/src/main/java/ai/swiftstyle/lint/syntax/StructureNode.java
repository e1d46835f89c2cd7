package ai.swiftstyle.lint.syntax;

import java.util.Objects;

/**
 * A structural node covering the character range {@code [offset, offset + length)}.
 */
public record StructureNode(StructureKind kind, int offset, int length) {

    public StructureNode {
        Objects.requireNonNull(kind, "kind");
        if (offset < 0 || length <= 0) {
            throw new IllegalArgumentException("Invalid node range");
        }
    }

    public int end() {
        return offset + length;
    }

    public boolean contains(int charOffset) {
        return charOffset >= offset && charOffset < end();
    }
}
