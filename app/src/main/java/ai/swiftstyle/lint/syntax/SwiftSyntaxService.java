package ai.swiftstyle.lint.syntax;

import ai.swiftstyle.lint.source.SourceBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link SyntaxQuery} over Swift source backed by {@link SwiftLexer} and a bracket-driven
 * structure pass. Built once per buffer.
 */
public class SwiftSyntaxService implements SyntaxQuery {

    private final SourceBuffer buffer;
    private final List<SyntaxToken> tokens;
    private final List<StructureNode> structure;

    public SwiftSyntaxService(SourceBuffer buffer) {
        this(buffer, new SwiftLexer());
    }

    SwiftSyntaxService(SourceBuffer buffer, SwiftLexer lexer) {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.tokens = List.copyOf(lexer.tokenize(buffer.text()));
        this.structure = List.copyOf(new SwiftStructureBuilder(buffer.text(), tokens).build());
    }

    public List<SyntaxToken> tokens() {
        return tokens;
    }

    public List<StructureNode> structure() {
        return structure;
    }

    @Override
    public Optional<SyntaxKind> kindAt(int byteOffset) {
        return tokenAt(buffer.charOffset(byteOffset)).map(SyntaxToken::kind);
    }

    @Override
    public List<StructureKind> structureKindsAt(int byteOffset) {
        int charOffset = buffer.charOffset(byteOffset);
        List<StructureKind> kinds = new ArrayList<>();
        // nodes are sorted by offset, then outer before inner
        for (StructureNode node : structure) {
            if (node.offset() > charOffset) {
                break;
            }
            if (node.contains(charOffset)) {
                kinds.add(node.kind());
            }
        }
        return kinds;
    }

    Optional<SyntaxToken> tokenAt(int charOffset) {
        int low = 0;
        int high = tokens.size() - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            SyntaxToken token = tokens.get(mid);
            if (token.end() <= charOffset) {
                low = mid + 1;
            } else if (token.offset() > charOffset) {
                high = mid - 1;
            } else {
                return Optional.of(token);
            }
        }
        return Optional.empty();
    }
}
