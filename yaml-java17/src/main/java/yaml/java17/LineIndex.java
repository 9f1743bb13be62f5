package yaml.java17;

import java.util.Arrays;

/// Maps char offsets of a source range to 1-based line and column numbers.
///
/// The range may be a slice of a larger source; `origin` is the location of the slice's first
/// char in the whole source, so locations stay absolute.
final class LineIndex {

    private final int[] starts;
    private final int count;
    private final Location origin;

    LineIndex(String source, int begin, int end, Location origin) {
        this.origin = origin;
        int[] lines = new int[16];
        int n = 0;
        lines[n++] = begin;
        for (int i = begin; i < end; i++) {
            final char c = source.charAt(i);
            if (c == '\n' || (c == '\r' && (i + 1 >= end || source.charAt(i + 1) != '\n'))) {
                if (n == lines.length) {
                    lines = Arrays.copyOf(lines, n * 2);
                }
                lines[n++] = i + 1;
            }
        }
        this.starts = lines;
        this.count = n;
    }

    private int lineIndexOf(int offset) {
        final int idx = Arrays.binarySearch(starts, 0, count, offset);
        return idx >= 0 ? idx : -idx - 2;
    }

    /// {@return the offset of the first char of the line containing `offset`}
    int lineStart(int offset) {
        return starts[lineIndexOf(offset)];
    }

    /// {@return the 0-based column of `offset` within its line of this range}
    int column(int offset) {
        return offset - lineStart(offset);
    }

    Location location(int offset) {
        final int idx = lineIndexOf(offset);
        final int column = offset - starts[idx] + 1 + (idx == 0 ? origin.column() - 1 : 0);
        return new Location(origin.line() + idx, column, offset);
    }
}
