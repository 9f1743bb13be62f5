package yaml.java17;

/// Character classes and line-level checks shared by {@link YamlScanner} and the document
/// splitter of the parallel dispatcher, so that both agree on what a document marker is.
public final class YamlLexical {

    private YamlLexical() {}

    public static boolean isBreak(char c) {
        return c == '\n' || c == '\r';
    }

    public static boolean isWhite(char c) {
        return c == ' ' || c == '\t';
    }

    /// {@return true if `p` is past the end, or at whitespace or a line break}
    public static boolean isBlankAt(CharSequence s, int p, int end) {
        if (p >= end) {
            return true;
        }
        final char c = s.charAt(p);
        return isWhite(c) || isBreak(c);
    }

    public static boolean isFlowIndicator(char c) {
        return c == ',' || c == '[' || c == ']' || c == '{' || c == '}';
    }

    /// {@return true if a `---` or `...` marker starts at `p`; the caller ensures `p` is a line start}
    public static boolean isDocumentMarker(CharSequence s, int p, int end) {
        return isDocumentStart(s, p, end) || isDocumentEnd(s, p, end);
    }

    public static boolean isDocumentStart(CharSequence s, int p, int end) {
        return matchesMarker(s, p, end, '-');
    }

    public static boolean isDocumentEnd(CharSequence s, int p, int end) {
        return matchesMarker(s, p, end, '.');
    }

    private static boolean matchesMarker(CharSequence s, int p, int end, char c) {
        return p + 3 <= end
                && s.charAt(p) == c && s.charAt(p + 1) == c && s.charAt(p + 2) == c
                && isBlankAt(s, p + 3, end);
    }

    /// {@return the offset of the line break (or `end`) that terminates the line containing `p`}
    public static int lineEnd(CharSequence s, int p, int end) {
        int i = p;
        while (i < end && !isBreak(s.charAt(i))) {
            i++;
        }
        return i;
    }

    /// {@return the offset of the first char of the line after the one containing `p`, or `end`}
    public static int nextLineStart(CharSequence s, int p, int end) {
        int i = lineEnd(s, p, end);
        if (i < end && s.charAt(i) == '\r') {
            i++;
        }
        if (i < end && s.charAt(i) == '\n') {
            i++;
        }
        return i;
    }

    /// {@return the number of leading spaces of the line starting at `lineStart`}
    public static int indentation(CharSequence s, int lineStart, int end) {
        int i = lineStart;
        while (i < end && s.charAt(i) == ' ') {
            i++;
        }
        return i - lineStart;
    }

    /// {@return true if the line starting at `lineStart` holds only whitespace or a comment}
    public static boolean isBlankOrCommentLine(CharSequence s, int lineStart, int end) {
        int i = lineStart;
        while (i < end && isWhite(s.charAt(i))) {
            i++;
        }
        return i >= end || isBreak(s.charAt(i)) || s.charAt(i) == '#';
    }
}
