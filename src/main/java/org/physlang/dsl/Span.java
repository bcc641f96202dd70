package org.physlang.dsl;

/**
 * Half-open range of character offsets into the program source.
 * Offsets count UTF-16 chars as {@link String#charAt} does, not bytes.
 *
 * @param start Offset of the first character
 * @param end   Offset one past the last character
 */
public record Span(int start, int end) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public static Span of(int start, int end) {
        return new Span(start, end);
    }

    /**
     * Converts the start offset to a 1-based line and column in the given source.
     */
    public SourcePosition toPosition(String source) {
        int line = 1;
        int column = 1;
        int limit = Math.min(start, source.length());
        for (int i = 0; i < limit; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return new SourcePosition(line, column);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
