package ai.swiftstyle.lint.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import org.junit.jupiter.api.Test;

class SourceBufferTest {

    @Test
    void locatesLinesAndColumns() {
        SourceBuffer buffer = new SourceBuffer("ab\ncd\n");

        assertThat(buffer.locate(0)).isEqualTo(new LineColumn(1, 1));
        assertThat(buffer.locate(2)).isEqualTo(new LineColumn(1, 3));
        assertThat(buffer.locate(3)).isEqualTo(new LineColumn(2, 1));
        assertThat(buffer.locate(4).toString()).isEqualTo("2:2");
        assertThat(buffer.locate(6)).isEqualTo(new LineColumn(3, 1));
        assertThat(buffer.lineCount()).isEqualTo(3);
    }

    @Test
    void columnsCountCodePoints() {
        // two grinning faces, each a surrogate pair, precede the keyword
        String text = "let a = 1\nx = \"\uD83D\uDE00\uD83D\uDE00\"; if (a) {}";
        SourceBuffer buffer = new SourceBuffer(text);

        assertThat(buffer.locate(text.indexOf("if"))).isEqualTo(new LineColumn(2, 11));
    }

    @Test
    void convertsBetweenCharacterAndUtf8ByteOffsets() {
        // a, e-acute (2 bytes), grinning face (surrogate pair, 4 bytes), b
        SourceBuffer buffer = new SourceBuffer("a\u00e9\uD83D\uDE00b");

        assertThat(buffer.byteOffset(0)).isZero();
        assertThat(buffer.byteOffset(1)).isEqualTo(1);
        assertThat(buffer.byteOffset(2)).isEqualTo(3);
        assertThat(buffer.byteOffset(3)).isEqualTo(3);
        assertThat(buffer.byteOffset(4)).isEqualTo(7);
        assertThat(buffer.byteLength()).isEqualTo(8);

        assertThat(buffer.charOffset(7)).isEqualTo(4);
        assertThat(buffer.charOffset(3)).isEqualTo(2);
        assertThat(buffer.charOffset(2)).isEqualTo(1);
        assertThat(buffer.charOffset(8)).isEqualTo(5);
    }

    @Test
    void rejectsOutOfRangeAccess() {
        SourceBuffer buffer = new SourceBuffer("if x {}");

        assertThat(buffer.charAt(-1)).isEmpty();
        assertThat(buffer.charAt(7)).isEmpty();
        assertThat(buffer.charAt(2)).contains(' ');
        assertThat(buffer.isBlankAt(2)).isTrue();
        assertThat(buffer.isBlankAt(0)).isFalse();
        assertThat(buffer.isBlankAt(99)).isFalse();
        assertThat(buffer.substring(3, 1)).isEqualTo("x");

        Throwable thrown = catchThrowable(() -> buffer.substring(5, 3));

        assertThat(thrown).isInstanceOf(IndexOutOfBoundsException.class)
                .hasMessageContaining("outside buffer");
    }
}
