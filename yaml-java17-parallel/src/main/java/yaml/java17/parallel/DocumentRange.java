package yaml.java17.parallel;

import yaml.java17.Location;

/// The source range `[start, end)` of one document, found by {@link DocumentSplitter}.
///
/// @param index  the position of the document in the stream, from 0
/// @param origin the location of `start` in the whole source
public record DocumentRange(int index, int start, int end, Location origin) {

    public DocumentRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid range [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }
}
