package yaml.java17;

import java.util.Objects;

/// A half-open `[start, end)` range of source text.
public record Span(Location start, Location end) {

    public Span {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (end.offset() < start.offset()) {
            throw new IllegalArgumentException("span end " + end + " is before start " + start);
        }
    }

    /// A zero-width span at the given location.
    public static Span at(Location location) {
        return new Span(location, location);
    }

    public int length() {
        return end.offset() - start.offset();
    }

    public boolean isEmpty() {
        return length() == 0;
    }

    /// {@return true if the span starts and ends on the same line}
    public boolean isSingleLine() {
        return start.line() == end.line();
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
