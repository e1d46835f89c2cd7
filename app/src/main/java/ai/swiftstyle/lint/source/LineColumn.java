package ai.swiftstyle.lint.source;

/**
 * One-based line and column of a character offset.
 */
public record LineColumn(int line, int column) {

    public LineColumn {
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("line and column are one-based");
        }
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
