package yaml.java17;

/// A position in YAML source text.
///
/// `line` and `column` are 1-based; `offset` is the 0-based UTF-16 char index into the
/// source string the position was computed against.
public record Location(int line, int column, int offset) implements Comparable<Location> {

    public Location {
        if (line < 1 || column < 1 || offset < 0) {
            throw new IllegalArgumentException(
                    "invalid location line=" + line + " column=" + column + " offset=" + offset);
        }
    }

    /// The location of the first character of a source.
    public static Location start() {
        return new Location(1, 1, 0);
    }

    @Override
    public int compareTo(Location other) {
        return Integer.compare(offset, other.offset);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
