package ai.swiftstyle.lint.rule.controlstatement;

import ai.swiftstyle.lint.source.SourceBuffer;
import ai.swiftstyle.lint.source.TextEdit;
import ai.swiftstyle.lint.source.TextEdits;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Strips the outer parentheses of accepted clause matches.
 *
 * <p>A parenthesis next to a blank is deleted; otherwise it becomes a blank, so {@code if(x)}
 * turns into {@code if x} without doubling spaces. Nested groups that each wrap the whole clause
 * are removed together. Edits are decided against the original buffer, latest match first, and
 * spliced in one ascending pass. Every violation is recorded, including one whose parentheses
 * cannot be located and which is therefore left as is.
 */
public class ParenCorrector {

    private static final Logger LOGGER = LoggerFactory.getLogger(ParenCorrector.class);
    private static final String BLANK = " ";

    private final ParenLocator locator;

    public ParenCorrector() {
        this(new ParenLocator());
    }

    public ParenCorrector(ParenLocator locator) {
        this.locator = Objects.requireNonNull(locator, "locator");
    }

    public CorrectionPlan correct(SourceBuffer buffer, List<ClauseMatch> violations) {
        Objects.requireNonNull(buffer, "buffer");
        if (violations == null || violations.isEmpty()) {
            return new CorrectionPlan(buffer.text(), List.of());
        }
        List<ClauseMatch> descending = new ArrayList<>(violations);
        descending.sort(Comparator.comparingInt(ClauseMatch::offset).reversed());

        List<TextEdit> edits = new ArrayList<>();
        Deque<ClauseMatch> recorded = new ArrayDeque<>();
        for (ClauseMatch violation : descending) {
            recorded.addFirst(violation);
            Optional<ParenPair> pair = locator.locate(buffer.text(), violation.offset(), violation.length());
            if (pair.isEmpty()) {
                LOGGER.warn("No enclosing parentheses found for '{}' at offset {}; leaving it untouched",
                        violation.keyword().spelling(), violation.offset());
                continue;
            }
            ParenPair outer = pair.get();
            ParenPair inner = innermostWrapped(buffer, outer);
            edits.add(closeEdit(buffer, inner.close(), outer.close()));
            edits.add(openEdit(buffer, outer.open(), inner.open()));
        }
        return new CorrectionPlan(TextEdits.apply(buffer.text(), edits), new ArrayList<>(recorded));
    }

    /**
     * Descends through pairs that wrap the whole content of their parent, as in {@code if ((a))},
     * so that one correction leaves no redundant group behind.
     */
    private ParenPair innermostWrapped(SourceBuffer buffer, ParenPair outer) {
        ParenPair current = outer;
        while (true) {
            int contentStart = current.open() + 1;
            Optional<ParenPair> inner = locator.locate(buffer.text(), contentStart, current.close() - contentStart);
            if (inner.isEmpty()
                    || !isBlankRange(buffer, contentStart, inner.get().open())
                    || !isBlankRange(buffer, inner.get().close() + 1, current.close())) {
                return current;
            }
            current = inner.get();
        }
    }

    private static boolean isBlankRange(SourceBuffer buffer, int from, int to) {
        for (int i = from; i < to; i++) {
            if (!Character.isWhitespace(buffer.text().charAt(i))) {
                return false;
            }
        }
        return true;
    }

    // the run from the innermost to the outermost close paren collapses into one edit
    private TextEdit closeEdit(SourceBuffer buffer, int innerClose, int outerClose) {
        String replacement = buffer.isBlankAt(outerClose + 1) ? "" : BLANK;
        return new TextEdit(innerClose, outerClose - innerClose + 1, replacement);
    }

    private TextEdit openEdit(SourceBuffer buffer, int outerOpen, int innerOpen) {
        String replacement = buffer.isBlankAt(outerOpen - 1) ? "" : BLANK;
        return new TextEdit(outerOpen, innerOpen - outerOpen + 1, replacement);
    }
}
