package ai.swiftstyle.lint.source;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Text of one source file with offset-addressed access. Line and byte tables are built lazily,
 * so an instance should stay confined to the thread processing the file.
 *
 * <p>Character offsets are {@link String} indices (UTF-16 code units). Byte offsets address the
 * UTF-8 encoding of the same text, which is what syntax services report. Columns reported by
 * {@link #locate(int)} count code points.
 */
public final class SourceBuffer {

    private final String text;
    private int[] lineStarts;
    private int[] byteOffsets;

    public SourceBuffer(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public String substring(int offset, int length) {
        if (offset < 0 || length < 0 || offset + length > text.length()) {
            throw new IndexOutOfBoundsException("Range [" + offset + ", " + (offset + length)
                    + ") is outside buffer of length " + text.length());
        }
        return text.substring(offset, offset + length);
    }

    /**
     * Bounds-checked character lookup.
     *
     * @return the character at {@code index}, or empty when the index lies outside the buffer
     */
    public Optional<Character> charAt(int index) {
        if (index < 0 || index >= text.length()) {
            return Optional.empty();
        }
        return Optional.of(text.charAt(index));
    }

    public boolean isBlankAt(int index) {
        return charAt(index).filter(ch -> ch == ' ').isPresent();
    }

    public int byteOffset(int charOffset) {
        int[] offsets = byteOffsets();
        if (charOffset < 0 || charOffset >= offsets.length) {
            throw new IndexOutOfBoundsException("Character offset " + charOffset + " is outside buffer of length " + text.length());
        }
        return offsets[charOffset];
    }

    /**
     * Maps a UTF-8 byte offset back to a character offset. Offsets inside a multi-byte sequence
     * resolve to the character that sequence encodes.
     */
    public int charOffset(int byteOffset) {
        int[] offsets = byteOffsets();
        if (byteOffset < 0 || byteOffset > offsets[offsets.length - 1]) {
            throw new IndexOutOfBoundsException("Byte offset " + byteOffset + " is outside buffer");
        }
        int index = Arrays.binarySearch(offsets, byteOffset);
        if (index >= 0) {
            // the low half of a surrogate pair shares the byte offset of its high half
            while (index > 0 && offsets[index - 1] == byteOffset) {
                index--;
            }
            return index;
        }
        return -index - 2;
    }

    public int byteLength() {
        int[] offsets = byteOffsets();
        return offsets[offsets.length - 1];
    }

    public LineColumn locate(int charOffset) {
        if (charOffset < 0 || charOffset > text.length()) {
            throw new IndexOutOfBoundsException("Character offset " + charOffset + " is outside buffer of length " + text.length());
        }
        int[] starts = lineStarts();
        int index = Arrays.binarySearch(starts, charOffset);
        int line = index >= 0 ? index : -index - 2;
        // columns count code points, so a surrogate pair is one column
        return new LineColumn(line + 1, text.codePointCount(starts[line], charOffset) + 1);
    }

    public int lineCount() {
        return lineStarts().length;
    }

    private int[] lineStarts() {
        if (lineStarts == null) {
            int count = 1;
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n') {
                    count++;
                }
            }
            int[] starts = new int[count];
            int line = 1;
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n') {
                    starts[line++] = i + 1;
                }
            }
            lineStarts = starts;
        }
        return lineStarts;
    }

    private int[] byteOffsets() {
        if (byteOffsets == null) {
            int[] offsets = new int[text.length() + 1];
            int bytes = 0;
            int i = 0;
            while (i < text.length()) {
                char ch = text.charAt(i);
                offsets[i] = bytes;
                if (Character.isHighSurrogate(ch) && i + 1 < text.length() && Character.isLowSurrogate(text.charAt(i + 1))) {
                    offsets[i + 1] = bytes;
                    bytes += 4;
                    i += 2;
                    continue;
                }
                bytes += utf8Length(ch);
                i++;
            }
            offsets[text.length()] = bytes;
            byteOffsets = offsets;
        }
        return byteOffsets;
    }

    private static int utf8Length(char ch) {
        if (ch < 0x80) {
            return 1;
        }
        if (ch < 0x800) {
            return 2;
        }
        return 3;
    }
}
