package ai.swiftstyle.lint.syntax;

import java.util.Objects;
import java.util.Optional;

/**
 * A textual pattern match and the syntax kind observed at its first character.
 */
public record SyntaxMatch(int offset, int length, Optional<SyntaxKind> leadingKind) {

    public SyntaxMatch {
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("Invalid match range");
        }
        leadingKind = Objects.requireNonNullElse(leadingKind, Optional.empty());
    }

    public int end() {
        return offset + length;
    }

    public boolean startsWithKeyword() {
        return leadingKind.filter(kind -> kind == SyntaxKind.KEYWORD).isPresent();
    }
}
