package yaml.java17.parallel;

import yaml.java17.Location;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static yaml.java17.YamlLexical.indentation;
import static yaml.java17.YamlLexical.isBlankAt;
import static yaml.java17.YamlLexical.isBlankOrCommentLine;
import static yaml.java17.YamlLexical.isDocumentEnd;
import static yaml.java17.YamlLexical.isDocumentMarker;
import static yaml.java17.YamlLexical.isDocumentStart;
import static yaml.java17.YamlLexical.isWhite;
import static yaml.java17.YamlLexical.lineEnd;
import static yaml.java17.YamlLexical.nextLineStart;

/// Finds the source range of every document of a stream in one sequential pass over its lines.
///
/// A `---` or `...` line at column 0 is a boundary unless it sits inside a flow collection or a
/// quoted scalar that spans lines; the scanner rejects a marker there, so the range is kept whole
/// and its worker reports the same error. Block scalar content is skipped so that quotes and
/// brackets in it are not mistaken for syntax.
///
/// A `---` range starts at its marker and a `...` range ends after its marker. Directives and
/// comments before a `---` stay with the document that follows. Ranges holding only blank lines
/// or comments are dropped.
final class DocumentSplitter {

    private static final Logger LOG = Logger.getLogger(DocumentSplitter.class.getName());

    private static final int NOT_IN_BLOCK_SCALAR = Integer.MIN_VALUE;

    private final String source;
    private final int end;
    private final List<DocumentRange> ranges = new ArrayList<>();

    private int flowDepth;
    private char quote;
    private int blockIndent = NOT_IN_BLOCK_SCALAR;

    private int rangeStart;
    private int rangeLine = 1;
    private boolean content;
    private boolean directives;

    private DocumentSplitter(String source) {
        this.source = source;
        this.end = source.length();
    }

    static List<DocumentRange> split(String source) {
        final DocumentSplitter splitter = new DocumentSplitter(source);
        splitter.run();
        LOG.finer(() -> "split " + source.length() + " chars into " + splitter.ranges.size() + " range(s)");
        return List.copyOf(splitter.ranges);
    }

    private void run() {
        int line = 1;
        int p = 0;
        while (p < end) {
            final int next = nextLineStart(source, p, end);
            if (quote == 0 && flowDepth == 0 && isDocumentMarker(source, p, end)) {
                blockIndent = NOT_IN_BLOCK_SCALAR;
                if (isDocumentStart(source, p, end)) {
                    if (content) {
                        emit(p);
                        rangeStart = p;
                        rangeLine = line;
                    }
                    content = true;
                    directives = false;
                    scanLine(p, p + 3, true);
                } else if (isDocumentEnd(source, p, end)) {
                    if (content || directives) {
                        emit(next);
                    }
                    rangeStart = next;
                    rangeLine = line + 1;
                    content = false;
                    directives = false;
                }
            } else if (blockIndent != NOT_IN_BLOCK_SCALAR && isBlockScalarLine(p)) {
                content = true;
            } else {
                blockIndent = NOT_IN_BLOCK_SCALAR;
                final boolean plainContext = quote == 0 && flowDepth == 0;
                if (plainContext && !content && source.charAt(p) == '%') {
                    directives = true;
                } else if (!plainContext || !isBlankOrCommentLine(source, p, end)) {
                    content = true;
                    scanLine(p, p, false);
                }
            }
            p = next;
            line++;
        }
        if (content || directives) {
            emit(end);
        }
    }

    private void emit(int rangeEnd) {
        final DocumentRange range = new DocumentRange(ranges.size(), rangeStart, rangeEnd,
                new Location(rangeLine, 1, rangeStart));
        LOG.finest(() -> "range " + range);
        ranges.add(range);
    }

    private boolean isBlockScalarLine(int lineStart) {
        final int indent = indentation(source, lineStart, end);
        return lineEnd(source, lineStart + indent, end) == lineStart + indent || indent > blockIndent;
    }

    /// Tracks quotes and flow brackets from `from` to the end of the line starting at `lineStart`,
    /// and notes a block scalar header.
    private void scanLine(int lineStart, int from, boolean afterDocumentStart) {
        final int to = lineEnd(source, from, end);
        final int indent = indentation(source, lineStart, end);
        for (int i = from; i < to; i++) {
            final char c = source.charAt(i);
            if (quote == '\'') {
                if (c == '\'') {
                    if (i + 1 < to && source.charAt(i + 1) == '\'') {
                        i++;
                    } else {
                        quote = 0;
                    }
                }
                continue;
            }
            if (quote == '"') {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    quote = 0;
                }
                continue;
            }
            final boolean tokenStart = i == lineStart || isWhite(source.charAt(i - 1))
                    || flowDepth > 0 && isFlowSeparator(source.charAt(i - 1));
            if (c == '#' && (i == lineStart || isWhite(source.charAt(i - 1)))) {
                return;
            }
            if (c == '\'' || c == '"') {
                if (tokenStart) {
                    quote = c;
                }
            } else if (c == '[' || c == '{') {
                if (tokenStart || flowDepth > 0) {
                    flowDepth++;
                }
            } else if ((c == ']' || c == '}') && flowDepth > 0) {
                flowDepth--;
            } else if ((c == '|' || c == '>') && tokenStart && flowDepth == 0 && isBlockScalarHeader(i + 1, to)) {
                final boolean firstOnLine = i == lineStart + indent;
                blockIndent = afterDocumentStart || firstOnLine && indent == 0 ? -1
                        : firstOnLine ? indent - 1 : indent;
                return;
            }
        }
    }

    private static boolean isFlowSeparator(char c) {
        return c == ',' || c == '[' || c == '{' || c == ':';
    }

    // Chomping and indentation indicators, then nothing but blanks or a comment.
    private boolean isBlockScalarHeader(int from, int to) {
        int i = from;
        while (i < to && "+-123456789".indexOf(source.charAt(i)) >= 0) {
            i++;
        }
        if (!isBlankAt(source, i, end)) {
            return false;
        }
        while (i < to && isWhite(source.charAt(i))) {
            i++;
        }
        return i >= to || source.charAt(i) == '#';
    }
}
