package ai.swiftstyle.lint.syntax;

import java.util.List;
import java.util.Optional;

/**
 * Lightweight syntax facts about one source buffer, addressed by UTF-8 byte offsets.
 */
public interface SyntaxQuery {

    /**
     * @return the kind of the token covering {@code byteOffset}, or empty for whitespace and punctuation
     */
    Optional<SyntaxKind> kindAt(int byteOffset);

    /**
     * @return kinds of all structural nodes enclosing {@code byteOffset}, outermost first
     */
    List<StructureKind> structureKindsAt(int byteOffset);
}
