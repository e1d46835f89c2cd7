package ai.swiftstyle.lint.source;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies edits computed against one buffer in a single ascending pass.
 */
public final class TextEdits {

    private static final Logger LOGGER = LoggerFactory.getLogger(TextEdits.class);

    private TextEdits() {
    }

    public static String apply(String text, List<TextEdit> edits) {
        Objects.requireNonNull(text, "text");
        if (edits == null || edits.isEmpty()) {
            return text;
        }
        List<TextEdit> ordered = new ArrayList<>(edits);
        ordered.sort(Comparator.comparingInt(TextEdit::offset));
        StringBuilder builder = new StringBuilder(text.length());
        int cursor = 0;
        for (TextEdit edit : ordered) {
            if (edit.end() > text.length()) {
                throw new IndexOutOfBoundsException("Edit " + edit + " exceeds text of length " + text.length());
            }
            if (edit.offset() < cursor) {
                LOGGER.debug("Dropping edit {} overlapping a previous edit ending at {}", edit, cursor);
                continue;
            }
            builder.append(text, cursor, edit.offset());
            builder.append(edit.replacement());
            cursor = edit.end();
        }
        builder.append(text, cursor, text.length());
        return builder.toString();
    }
}
