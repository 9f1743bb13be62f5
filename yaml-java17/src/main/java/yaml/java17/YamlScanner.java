package yaml.java17;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.logging.Logger;

import static yaml.java17.YamlLexical.indentation;
import static yaml.java17.YamlLexical.isBlankAt;
import static yaml.java17.YamlLexical.isBlankOrCommentLine;
import static yaml.java17.YamlLexical.isBreak;
import static yaml.java17.YamlLexical.isDocumentEnd;
import static yaml.java17.YamlLexical.isDocumentMarker;
import static yaml.java17.YamlLexical.isDocumentStart;
import static yaml.java17.YamlLexical.isFlowIndicator;
import static yaml.java17.YamlLexical.isWhite;
import static yaml.java17.YamlLexical.lineEnd;
import static yaml.java17.YamlLexical.nextLineStart;

/// Scans YAML text into a lazy, finite, non-restartable sequence of {@link YamlEvent}s.
///
/// The scanner is a recursive descent over the source with an explicit notion of the enclosing
/// block indentation. Events are produced one document at a time: the next document is scanned
/// only once the consumer has drained the events of the previous one.
///
/// A scanner may cover a slice `[start, end)` of a larger source. Locations are then reported
/// relative to the whole source, given the `origin` of the slice.
///
/// In {@link ErrorMode#COLLECT} a problem is recorded instead of thrown. Inside a root block
/// collection the scanner resumes at the next line indented no deeper than the collection (the
/// next top-level entry); anywhere else it resumes at the next document marker. Open collections
/// are closed so that the event stream stays balanced.
public final class YamlScanner implements Iterator<YamlEvent> {

    private static final Logger LOG = Logger.getLogger(YamlScanner.class.getName());

    /// Maximum nesting of collections within one document.
    public static final int MAX_DEPTH = 256;

    private static final Map<String, String> DEFAULT_HANDLES = Map.of("!", "!", "!!", CoreSchema.TAG_PREFIX);

    private final String src;
    private final int end;
    private final ErrorMode mode;
    private final LineIndex lines;
    private final List<YamlSyntaxException> problems = new ArrayList<>();

    private final List<YamlEvent> buffer = new ArrayList<>();
    private int readIndex;
    private final Deque<Character> open = new ArrayDeque<>();
    private final Map<String, String> handles = new HashMap<>(DEFAULT_HANDLES);

    private int pos;
    private int depth;
    private int lastEnd;
    private boolean started;
    private boolean finished;
    private boolean lastWasJsonLike;
    private int documentCount;

    public YamlScanner(String source) {
        this(source, ErrorMode.FAIL_FAST);
    }

    public YamlScanner(String source, ErrorMode mode) {
        this(source, 0, Objects.requireNonNull(source, "source must not be null").length(), Location.start(), mode);
    }

    /// Scans the slice `[start, end)` of `source`.
    ///
    /// @param origin the location of `source.charAt(start)` within the whole source
    public YamlScanner(String source, int start, int end, Location origin, ErrorMode mode) {
        this.src = Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(origin, "origin must not be null");
        if (start < 0 || end > source.length() || start > end) {
            throw new IndexOutOfBoundsException("range [" + start + ", " + end + ") of length " + source.length());
        }
        this.end = end;
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.lines = new LineIndex(source, start, end, origin);
        this.pos = start;
        this.lastEnd = start;
    }

    /// {@return the problems recorded so far in `COLLECT` mode}
    public List<YamlSyntaxException> problems() {
        return List.copyOf(problems);
    }

    @Override
    public boolean hasNext() {
        while (readIndex >= buffer.size()) {
            if (finished) {
                return false;
            }
            buffer.clear();
            readIndex = 0;
            fill();
        }
        return true;
    }

    @Override
    public YamlEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return buffer.get(readIndex++);
    }

    private void fill() {
        if (!started) {
            started = true;
            if (pos < end && src.charAt(pos) == '\uFEFF') {
                pos++;
            }
            buffer.add(new YamlEvent.StreamStart(Span.at(loc(pos))));
            return;
        }
        scanDocument();
    }

    // ---------------------------------------------------------------- documents

    private void scanDocument() {
        final int directives = scanDirectivesAndNoise();
        if (pos >= end) {
            if (directives > 0) {
                problem(YamlSyntaxException.Reason.INVALID_DIRECTIVE,
                        "directives must be followed by a '---' document start marker", end);
            }
            buffer.add(new YamlEvent.StreamEnd(Span.at(loc(end))));
            finished = true;
            LOG.finer(() -> "stream end after " + documentCount + " document(s)");
            return;
        }
        final int docStart = pos;
        boolean explicitStart = false;
        if (isDocumentStart(src, pos, end) && column(pos) == 0) {
            explicitStart = true;
            pos += 3;
        } else if (directives > 0) {
            problem(YamlSyntaxException.Reason.INVALID_DIRECTIVE,
                    "directives must be followed by a '---' document start marker", pos);
        }
        documentCount++;
        buffer.add(new YamlEvent.DocumentStart(span(docStart, pos), explicitStart));
        try {
            if (!explicitStart) {
                checkIndentation();
            }
            parseBlockNode(-1, !explicitStart, false);
            finishDocumentContent();
        } catch (YamlSyntaxException ex) {
            if (mode == ErrorMode.FAIL_FAST) {
                throw ex;
            }
            record(ex);
            closeOpen(0);
            depth = 0;
            skipToDocumentBoundary();
        }
        boolean explicitEnd = false;
        final int endStart = pos;
        if (pos < end && isDocumentEnd(src, pos, end) && column(pos) == 0) {
            explicitEnd = true;
            pos += 3;
            skipWhite();
            skipComment();
            if (pos < end && !isBreak(src.charAt(pos))) {
                problem(YamlSyntaxException.Reason.UNEXPECTED_CHARACTER,
                        "unexpected content after a document end marker", pos);
                pos = lineEnd(src, pos, end);
            }
            if (pos < end) {
                consumeBreak();
            }
        }
        buffer.add(new YamlEvent.DocumentEnd(span(endStart, explicitEnd ? endStart + 3 : endStart), explicitEnd));
        handles.clear();
        handles.putAll(DEFAULT_HANDLES);
        final int events = buffer.size();
        LOG.finest(() -> "scanned document " + documentCount + " events=" + events);
    }

    /// Skips blank and comment lines, stray `...` markers and directives before a document.
    /// {@return the number of directives seen}
    private int scanDirectivesAndNoise() {
        int directives = 0;
        boolean sawYaml = false;
        while (pos < end) {
            if (src.charAt(pos) == '\uFEFF') {
                pos++;
                continue;
            }
            if (isBlankOrCommentLine(src, pos, end)) {
                pos = nextLineStart(src, pos, end);
                continue;
            }
            if (src.charAt(pos) == '%' && column(pos) == 0) {
                sawYaml |= parseDirective(sawYaml);
                directives++;
                continue;
            }
            if (directives == 0 && isDocumentEnd(src, pos, end) && column(pos) == 0) {
                pos = nextLineStart(src, pos, end);
                continue;
            }
            break;
        }
        return directives;
    }

    /// {@return true if the directive was a `%YAML` directive}
    private boolean parseDirective(boolean sawYaml) {
        final int start = pos;
        pos++;
        final int nameStart = pos;
        while (pos < end && !isBlankAt(src, pos, end)) {
            pos++;
        }
        final String name = src.substring(nameStart, pos);
        final List<String> params = new ArrayList<>();
        while (true) {
            skipWhite();
            if (pos >= end || isBreak(src.charAt(pos)) || src.charAt(pos) == '#') {
                break;
            }
            final int p = pos;
            while (pos < end && !isBlankAt(src, pos, end)) {
                pos++;
            }
            params.add(src.substring(p, pos));
        }
        pos = nextLineStart(src, pos, end);
        switch (name) {
            case "YAML" -> {
                if (sawYaml) {
                    problem(YamlSyntaxException.Reason.INVALID_DIRECTIVE, "duplicate %YAML directive", start);
                } else if (params.size() != 1 || !params.get(0).matches("[0-9]+\\.[0-9]+")) {
                    problem(YamlSyntaxException.Reason.INVALID_DIRECTIVE, "malformed %YAML directive", start);
                } else if (!params.get(0).startsWith("1.")) {
                    problem(YamlSyntaxException.Reason.INVALID_DIRECTIVE,
                            "unsupported YAML version " + params.get(0), start);
                }
                return true;
            }
            case "TAG" -> {
                if (params.size() != 2 || !params.get(0).matches("!([0-9A-Za-z-]*!)?")) {
                    problem(YamlSyntaxException.Reason.INVALID_DIRECTIVE, "malformed %TAG directive", start);
                } else {
                    handles.put(params.get(0), params.get(1));
                }
                return false;
            }
            default -> {
                LOG.fine(() -> "ignoring reserved directive %" + name);
                return false;
            }
        }
    }

    private void finishDocumentContent() {
        skipToContent();
        if (pos >= end || atDocumentMarker()) {
            return;
        }
        throw error(YamlSyntaxException.Reason.UNEXPECTED_CHARACTER,
                "unexpected content after the document root node", pos);
    }

    // ---------------------------------------------------------------- block context

    /// Parses the node that follows an indicator (`key:`, `- `, `? `, `---`) or starts a document.
    ///
    /// @param parentIndent        the indentation of the enclosing block collection, -1 at the root
    /// @param compactAllowed      whether a block collection may start on the indicator's line
    /// @param indentlessSequence  whether a sequence at `parentIndent` belongs to this node
    private void parseBlockNode(int parentIndent, boolean compactAllowed, boolean indentlessSequence) {
        skipWhite();
        final Props props = readProperties(false);
        skipWhite();
        skipComment();
        if (!atLineEnd()) {
            parseInlineContent(parentIndent, props, compactAllowed);
            return;
        }
        final int emptyAt = pos;
        skipToContent();
        if (pos >= end || atDocumentMarker()) {
            emitEmpty(props, emptyAt);
            return;
        }
        final int col = column(pos);
        if (col > parentIndent) {
            parseBlockContent(col, parentIndent, props);
        } else if (col == parentIndent && indentlessSequence && atSequenceIndicator()) {
            parseBlockSequence(col, props, true);
        } else {
            emitEmpty(props, emptyAt);
        }
    }

    /// Parses a node that starts a line, at column `col`.
    private void parseBlockContent(int col, int parentIndent, Props outer) {
        final Props lineProps = readProperties(false);
        skipWhite();
        if (!lineProps.isEmpty()) {
            skipComment();
            if (atLineEnd()) {
                final Props merged = merge(outer, lineProps);
                final int emptyAt = pos;
                skipToContent();
                if (pos >= end || atDocumentMarker() || column(pos) <= parentIndent) {
                    emitEmpty(merged, emptyAt);
                } else {
                    parseBlockContent(column(pos), parentIndent, merged);
                }
                return;
            }
        }
        if (atSequenceIndicator()) {
            if (!lineProps.isEmpty()) {
                throw error(YamlSyntaxException.Reason.UNEXPECTED_CHARACTER,
                        "node properties of a block sequence must be on a separate line", lineProps.start());
            }
            parseBlockSequence(col, outer, false);
            return;
        }
        if (atExplicitKey() || isImplicitKeyAhead()) {
            parseBlockMapping(col, outer, lineProps);
            return;
        }
        final Props merged = merge(outer, lineProps);
        if (peek() == '|' || peek() == '>') {
            readBlockScalar(parentIndent, merged);
            return;
        }
        parseScalarOrFlow(parentIndent, merged, false);
        finishInlineNode();
    }

    /// Parses a node that starts on the same line as its indicator.
    private void parseInlineContent(int parentIndent, Props props, boolean compactAllowed) {
        final char c = peek();
        if (c == '|' || c == '>') {
            readBlockScalar(parentIndent, props);
            return;
        }
        final int col = column(props.isEmpty() ? pos : props.start());
        if (atSequenceIndicator()) {
            if (!compactAllowed || !props.isEmpty()) {
                throw error(YamlSyntaxException.Reason.UNEXPECTED_CHARACTER,
                        "block sequence entries are not allowed in this context", pos);
            }
            parseBlockSequence(col, Props.NONE, false);
            return;
        }
        if (atExplicitKey() || isImplicitKeyAhead()) {
            if (!compactAllowed) {
                throw error(YamlSyntaxException.Reason.UNEXPECTED_CHARACTER,
                        "mapping values are not allowed in this context", pos);
            }
            parseBlockMapping(col, Props.NONE, props);
            return;
        }
        parseScalarOrFlow(parentIndent, props, false);
        finishInlineNode();
    }

    private void finishInlineNode() {
        skipWhite();
        skipComment();
        if (atLineEnd()) {
            return;
        }
        if (peek() == ':') {
            throw error(YamlSyntaxException.Reason.UNEXPECTED_CHARACTER,
                    "mapping values are not allowed in this context", pos);
        }
        throw error(YamlSyntaxException.Reason.UNEXPECTED_CHARACTER,
                "unexpected character '" + peek() + "' after a node", pos);
    }

    private void parseBlockMapping(int indent, Props mappingProps, Props firstKeyProps) {
        final int start = mappingProps.isEmpty() ? (firstKeyProps.isEmpty() ? pos : firstKeyProps.start()) : mappingProps.start();
        emitProps(mappingProps);
        enter();
        buffer.add(new YamlEvent.MappingStart(Span.at(loc(start)), YamlEvent.CollectionStyle.BLOCK, mappingProps.tag()));
        open.push('M');
        final boolean recoverable = mode == ErrorMode.COLLECT && open.size() == 1;
        Props keyProps = firstKeyProps;
        while (true) {
            final int openBefore = open.size();
            final int depthBefore = depth;
            final int entryStart = pos;
            try {
                parseMappingEntry(indent, keyProps);
                keyProps = Props.NONE;
                skipToContent();
                if (pos >= end || atDocumentMarker() || column(pos) < indent) {
                    break;
                }
                if (column(pos) > indent) {
                    throw error(YamlSyntaxException.Reason.BAD_INDENTATION, "bad indentation of a mapping entry", pos);
                }
                if (atSequenceIndicator()) {
                    throw error(YamlSyntaxException.Reason.UNEXPECTED_CHARACTER,
                            "expected a mapping key but found a block sequence entry", pos);
                }
            } catch (YamlSyntaxException ex) {
                if (!recoverable) {
                    throw ex;
                }
                record(ex);
                closeOpen(openBefore);
                depth = depthBefore;
                keyProps = Props.NONE;
                skipToResyncPoint(indent, entryStart, ex.location().offset());
                if (pos >= end || atDocumentMarker() || column(pos) < indent) {
                    break;
                }
            }
        }
        buffer.add(new YamlEvent.MappingEnd(Span.at(loc(Math.max(lastEnd, start)))));
        open.pop();
        exit();
    }

    private void parseMappingEntry(int indent, Props keyProps) {
        if (atExplicitKey()) {
            if (!keyProps.isEmpty()) {
                throw error(YamlSyntaxException.Reason.UNEXPECTED_CHARACTER,
                        "node properties cannot precede an explicit key indicator", keyProps.start());
            }
            pos++;
            parseBlockNode(indent, true, true);
            skipToContent();
            if (pos < end && !atDocumentMarker() && column(pos) == indent
                    && peek() == ':' && isBlankAt(src, pos + 1, end)) {
                pos++;
                parseBlockNode(indent, true, true);
            } else {
                emitEmpty(Props.NONE, lastEnd);
            }
            return;
        }
        if (peek() == ':' && isBlankAt(src, pos + 1, end)) {
            emitEmpty(keyProps, pos);
            pos++;
            parseBlockNode(indent, false, true);
            return;
        }
        Props props = keyProps;
        if (props.isEmpty()) {
            props = readProperties(false);
            skipWhite();
        }
        parseScalarOrFlow(indent, props, true);
        skipWhite();
        if (peek() != ':') {
            throw error(YamlSyntaxException.Reason.UNEXPECTED_CHARACTER, "could not find expected ':'", pos);
        }
        pos++;
        if (!isBlankAt(src, pos, end)) {
            throw error(YamlSyntaxException.Reason.UNEXPECTED_CHARACTER,
                    "expected whitespace after ':' in a block mapping", pos);
        }
        parseBlockNode(indent, false, true);
    }

    private void parseBlockSequence(int indent, Props props, boolean indentless) {
        final int start = pos;
        emitProps(props);
        enter();
        buffer.add(new YamlEvent.SequenceStart(Span.at(loc(start)), YamlEvent.CollectionStyle.BLOCK, props.tag()));
        open.push('S');
        final boolean recoverable = mode == ErrorMode.COLLECT && open.size() == 1;
        while (true) {
            final int openBefore = open.size();
            final int depthBefore = depth;
            final int entryStart = pos;
            try {
                if (!atSequenceIndicator()) {
                    throw error(YamlSyntaxException.Reason.UNEXPECTED_CHARACTER,
                            "expected '- ' for a block sequence entry", pos);
                }
                pos++;
                parseBlockNode(indent, true, false);
                skipToContent();
                if (pos >= end || atDocumentMarker() || column(pos) < indent) {
                    break;
                }
                if (column(pos) > indent) {
                    throw error(YamlSyntaxException.Reason.BAD_INDENTATION, "bad indentation of a sequence entry", pos);
                }
                if (!atSequenceIndicator() && indentless) {
                    break;
                }
            } catch (YamlSyntaxException ex) {
                if (!recoverable) {
                    throw ex;
                }
                record(ex);
                closeOpen(openBefore);
                depth = depthBefore;
                skipToResyncPoint(indent, entryStart, ex.location().offset());
                if (pos >= end || atDocumentMarker() || column(pos) < indent) {
                    break;
                }
            }
        }
        buffer.add(new YamlEvent.SequenceEnd(Span.at(loc(Math.max(lastEnd, start)))));
        open.pop();
        exit();
    }

    /// Looks ahead on the current line for `: ` after a single-line key.
    private boolean isImplicitKeyAhead() {
        final int lineEnd = lineEnd(src, pos, end);
        int p = pos;
        if (p >= lineEnd) {
            return false;
        }
        final char c = src.charAt(p);
        if (c == '"' || c == '\'') {
            p = skipQuotedOnLine(p, lineEnd);
        } else if (c == '[' || c == '{') {
            p = skipFlowOnLine(p, lineEnd);
        } else if (c == '*') {
            p++;
            while (p < lineEnd && !isWhite(src.charAt(p)) && !isFlowIndicator(src.charAt(p))) {
                p++;
            }
        } else {
            if (c == '#') {
                return false;
            }
            while (p < lineEnd) {
                final char ch = src.charAt(p);
                if (ch == ':' && isBlankAt(src, p + 1, end)) {
                    return true;
                }
                if (ch == '#' && p > pos && isWhite(src.charAt(p - 1))) {
                    return false;
                }
                p++;
            }
            return false;
        }
        if (p < 0) {
            return false;
        }
        while (p < lineEnd && isWhite(src.charAt(p))) {
            p++;
        }
        return p < lineEnd && src.charAt(p) == ':' && isBlankAt(src, p + 1, end);
    }

    private int skipQuotedOnLine(int p, int lineEnd) {
        final char quote = src.charAt(p);
        int i = p + 1;
        while (i < lineEnd) {
            final char ch = src.charAt(i);
            if (quote == '"' && ch == '\\') {
                i += 2;
                continue;
            }
            if (ch == quote) {
                if (quote == '\'' && i + 1 < lineEnd && src.charAt(i + 1) == '\'') {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return -1;
    }

    private int skipFlowOnLine(int p, int lineEnd) {
        int nesting = 0;
        int i = p;
        while (i < lineEnd) {
            final char ch = src.charAt(i);
            if (ch == '[' || ch == '{') {
                nesting++;
            } else if (ch == ']' || ch == '}') {
                nesting--;
                if (nesting == 0) {
                    return i + 1;
                }
            } else if ((ch == '"' || ch == '\'') && (isWhite(src.charAt(i - 1)) || isFlowIndicator(src.charAt(i - 1)))) {
                final int q = skipQuotedOnLine(i, lineEnd);
                if (q < 0) {
                    return -1;
                }
                i = q;
                continue;
            }
            i++;
        }
        return -1;
    }

    /// Reads a node that is an alias, a flow collection, a quoted or a plain scalar.
    private void parseScalarOrFlow(int parentIndent, Props props, boolean key) {
        final char c = peek();
        if (c == '*') {
            if (!props.isEmpty()) {
                throw error(YamlSyntaxException.Reason.UNEXPECTED_CHARACTER,
                        "an alias node cannot have properties", props.start());
            }
            readAlias();
            return;
        }
        emitProps(props);
        if (c == '[' || c == '{') {
            parseFlowCollection(parentIndent, props.tag());
        } else if (c == '"' || c == '\'') {
            readQuoted(c, props.tag());
        } else {
            readPlain(parentIndent, false, key, props.tag());
        }
    }

    // ---------------------------------------------------------------- flow context

    private void parseFlowCollection(int blockIndent, String tag) {
        final int start = pos;
        final boolean sequence = src.charAt(pos) == '[';
        final char close = sequence ? ']' : '}';
        enter();
        if (sequence) {
            buffer.add(new YamlEvent.SequenceStart(Span.at(loc(start)), YamlEvent.CollectionStyle.FLOW, tag));
        } else {
            buffer.add(new YamlEvent.MappingStart(Span.at(loc(start)), YamlEvent.CollectionStyle.FLOW, tag));
        }
        open.push(sequence ? 'S' : 'M');
        pos++;
        boolean first = true;
        while (true) {
            skipFlowSpace(blockIndent, start);
            if (peek() == close) {
                pos++;
                break;
            }
            if (!first) {
                if (peek() != ',') {
                    throw error(YamlSyntaxException.Reason.UNEXPECTED_CHARACTER,
                            "expected ',' or '" + close + "' in a flow collection", pos);
                }
                pos++;
                skipFlowSpace(blockIndent, start);
                if (peek() == close) {
                    pos++;
                    break;
                }
            }
            if (peek() == ',') {
                throw error(YamlSyntaxException.Reason.UNEXPECTED_CHARACTER, "unexpected ',' in a flow collection", pos);
            }
            if (sequence) {
                parseFlowSequenceEntry(blockIndent, start);
            } else {
                parseFlowMappingEntry(blockIndent, start, close);
            }
            first = false;
        }
        lastEnd = pos;
        if (sequence) {
            buffer.add(new YamlEvent.SequenceEnd(span(pos - 1, pos)));
        } else {
            buffer.add(new YamlEvent.MappingEnd(span(pos - 1, pos)));
        }
        open.pop();
        exit();
        lastWasJsonLike = true;
    }

    private void parseFlowSequenceEntry(int blockIndent, int openedAt) {
        if (atExplicitKey()) {
            final int start = pos;
            enter();
            buffer.add(new YamlEvent.MappingStart(Span.at(loc(start)), YamlEvent.CollectionStyle.FLOW, null));
            open.push('M');
            pos++;
            skipFlowSpace(blockIndent, openedAt);
            if (atValueIndicator(false) || peek() == ',' || peek() == ']') {
                emitEmpty(Props.NONE, pos);
            } else {
                parseFlowNode(blockIndent, openedAt);
            }
            skipFlowSpace(blockIndent, openedAt);
            parseFlowPairValue(blockIndent, openedAt, ']', false);
            buffer.add(new YamlEvent.MappingEnd(Span.at(loc(Math.max(lastEnd, start)))));
            open.pop();
            exit();
            return;
        }
        final int mark = buffer.size();
        final int entryStart = pos;
        if (atValueIndicator(false)) {
            emitEmpty(Props.NONE, pos);
            lastWasJsonLike = false;
        } else {
            parseFlowNode(blockIndent, openedAt);
        }
        final boolean jsonLike = lastWasJsonLike;
        skipFlowSpace(blockIndent, openedAt);
        if (atValueIndicator(jsonLike)) {
            enter();
            buffer.add(mark, new YamlEvent.MappingStart(Span.at(loc(entryStart)), YamlEvent.CollectionStyle.FLOW, null));
            open.push('M');
            parseFlowPairValue(blockIndent, openedAt, ']', jsonLike);
            buffer.add(new YamlEvent.MappingEnd(Span.at(loc(Math.max(lastEnd, entryStart)))));
            open.pop();
            exit();
        }
    }

    private void parseFlowMappingEntry(int blockIndent, int openedAt, char close) {
        final boolean explicit = atExplicitKey();
        if (explicit) {
            pos++;
            skipFlowSpace(blockIndent, openedAt);
        }
        if (atValueIndicator(false)) {
            emitEmpty(Props.NONE, pos);
            lastWasJsonLike = false;
        } else if (explicit && (peek() == ',' || peek() == close)) {
            emitEmpty(Props.NONE, pos);
            emitEmpty(Props.NONE, pos);
            return;
        } else {
            parseFlowNode(blockIndent, openedAt);
        }
        final boolean jsonLike = lastWasJsonLike;
        skipFlowSpace(blockIndent, openedAt);
        parseFlowPairValue(blockIndent, openedAt, close, jsonLike);
    }

    /// Parses `: value` after a flow key, or emits an empty value when there is no `:`.
    private void parseFlowPairValue(int blockIndent, int openedAt, char close, boolean jsonLike) {
        if (!atValueIndicator(jsonLike)) {
            emitEmpty(Props.NONE, lastEnd);
            return;
        }
        pos++;
        skipFlowSpace(blockIndent, openedAt);
        if (peek() == ',' || peek() == close) {
            emitEmpty(Props.NONE, pos);
        } else {
            parseFlowNode(blockIndent, openedAt);
        }
    }

    private void parseFlowNode(int blockIndent, int openedAt) {
        lastWasJsonLike = false;
        final Props props = readProperties(true);
        if (!props.isEmpty()) {
            skipFlowSpace(blockIndent, openedAt);
        }
        final char c = peek();
        if (c == '*') {
            if (!props.isEmpty()) {
                throw error(YamlSyntaxException.Reason.UNEXPECTED_CHARACTER,
                        "an alias node cannot have properties", props.start());
            }
            readAlias();
            return;
        }
        if (!props.isEmpty() && (c == ',' || c == ']' || c == '}' || atValueIndicator(false))) {
            emitEmpty(props, pos);
            return;
        }
        if ((c == '-' || c == '?' || c == ':') && isBlankAt(src, pos + 1, end)) {
            throw error(YamlSyntaxException.Reason.UNEXPECTED_CHARACTER,
                    "unexpected '" + c + "' indicator inside a flow collection", pos);
        }
        if (c == ']' || c == '}') {
            throw error(YamlSyntaxException.Reason.UNEXPECTED_CHARACTER, "unexpected '" + c + "'", pos);
        }
        emitProps(props);
        if (c == '[' || c == '{') {
            parseFlowCollection(blockIndent, props.tag());
        } else if (c == '"' || c == '\'') {
            readQuoted(c, props.tag());
            lastWasJsonLike = true;
        } else {
            readPlain(blockIndent, true, false, props.tag());
        }
    }

    private boolean atValueIndicator(boolean jsonLike) {
        if (peek() != ':') {
            return false;
        }
        return jsonLike || isBlankAt(src, pos + 1, end) || isFlowIndicator(src.charAt(pos + 1));
    }

    /// Skips whitespace, comments and line breaks inside a flow collection. Every new line must
    /// be indented past the enclosing block; a closing bracket is exempt.
    private void skipFlowSpace(int blockIndent, int openedAt) {
        while (true) {
            skipWhite();
            if (pos >= end) {
                throw error(YamlSyntaxException.Reason.UNCLOSED_FLOW,
                        "unexpected end of stream inside a flow collection", openedAt);
            }
            final char c = src.charAt(pos);
            if (c == '#') {
                if (pos > 0 && !isWhite(src.charAt(pos - 1)) && !isBreak(src.charAt(pos - 1))) {
                    throw error(YamlSyntaxException.Reason.UNEXPECTED_CHARACTER,
                            "comments must be separated from other tokens by whitespace", pos);
                }
                skipComment();
                continue;
            }
            if (!isBreak(c)) {
                return;
            }
            consumeBreak();
            if (pos < end && isDocumentMarker(src, pos, end)) {
                throw error(YamlSyntaxException.Reason.UNCLOSED_FLOW,
                        "document marker inside a flow collection", pos);
            }
            int q = pos;
            while (q < end && isWhite(src.charAt(q))) {
                q++;
            }
            if (q >= end || isBreak(src.charAt(q)) || src.charAt(q) == '#') {
                continue;
            }
            final char first = src.charAt(q);
            if (first == '-' && isBlankAt(src, q + 1, end)) {
                throw error(YamlSyntaxException.Reason.UNEXPECTED_CHARACTER,
                        "block sequence entries are not allowed inside a flow collection", q);
            }
            if (q - pos <= blockIndent && first != ']' && first != '}') {
                throw error(YamlSyntaxException.Reason.BAD_INDENTATION,
                        "flow collection lines must be indented more than the enclosing block", q);
            }
        }
    }

    // ---------------------------------------------------------------- scalars and properties

    private void readAlias() {
        final int start = pos;
        pos++;
        final String name = readName();
        if (name.isEmpty()) {
            throw error(YamlSyntaxException.Reason.UNEXPECTED_CHARACTER, "alias name must not be empty", start);
        }
        lastEnd = pos;
        buffer.add(new YamlEvent.Alias(span(start, pos), name));
    }

    private String readName() {
        final int start = pos;
        while (pos < end && !isBlankAt(src, pos, end) && !isFlowIndicator(src.charAt(pos))) {
            pos++;
        }
        return src.substring(start, pos);
    }

    private Props readProperties(boolean flow) {
        String anchor = null;
        Span anchorSpan = null;
        String tag = null;
        int start = -1;
        while (pos < end) {
            final char c = src.charAt(pos);
            if (c == '&' && anchor == null) {
                if (start < 0) {
                    start = pos;
                }
                final int s = pos;
                pos++;
                anchor = readName();
                if (anchor.isEmpty()) {
                    throw error(YamlSyntaxException.Reason.UNEXPECTED_CHARACTER, "anchor name must not be empty", s);
                }
                anchorSpan = span(s, pos);
            } else if (c == '!' && tag == null) {
                if (start < 0) {
                    start = pos;
                }
                tag = readTag(flow);
            } else {
                break;
            }
            if (!isBlankAt(src, pos, end) && !(flow && isFlowIndicator(src.charAt(pos)))) {
                throw error(YamlSyntaxException.Reason.UNEXPECTED_CHARACTER,
                        "expected whitespace after a node property", pos);
            }
            skipWhite();
        }
        return start < 0 ? Props.NONE : new Props(anchor, anchorSpan, tag, start);
    }

    private String readTag(boolean flow) {
        final int start = pos;
        pos++;
        if (pos < end && src.charAt(pos) == '<') {
            final int close = src.indexOf('>', pos);
            if (close < 0 || close >= lineEnd(src, pos, end)) {
                throw error(YamlSyntaxException.Reason.UNEXPECTED_CHARACTER, "unterminated verbatim tag", start);
            }
            final String verbatim = src.substring(pos + 1, close);
            pos = close + 1;
            return verbatim;
        }
        while (pos < end && !isBlankAt(src, pos, end) && !(flow && isFlowIndicator(src.charAt(pos)))) {
            pos++;
        }
        final String token = src.substring(start, pos);
        if (token.equals("!")) {
            return "!";
        }
        final int second = token.indexOf('!', 1);
        final String handle = second > 0 ? token.substring(0, second + 1) : "!";
        final String suffix = second > 0 ? token.substring(second + 1) : token.substring(1);
        final String prefix = handles.get(handle);
        if (prefix == null) {
            throw error(YamlSyntaxException.Reason.INVALID_DIRECTIVE, "undefined tag handle " + handle, start);
        }
        return prefix + suffix;
    }

    private void readPlain(int parentIndent, boolean flow, boolean key, String tag) {
        final int start = pos;
        final char c = peek();
        if (cannotStartPlain(c) || ((c == '-' || c == '?' || c == ':')
                && (isBlankAt(src, pos + 1, end) || (flow && isFlowIndicator(src.charAt(pos + 1)))))) {
            throw error(YamlSyntaxException.Reason.UNEXPECTED_CHARACTER,
                    "found character '" + c + "' that cannot start any token", pos);
        }
        final StringBuilder sb = new StringBuilder();
        int contentEnd = pos;
        int pendingBreaks = -1;
        while (true) {
            final int segStart = pos;
            while (pos < end) {
                final char ch = src.charAt(pos);
                if (isBreak(ch)) {
                    break;
                }
                if (ch == ':' && (isBlankAt(src, pos + 1, end) || (flow && isFlowIndicator(src.charAt(pos + 1))))) {
                    break;
                }
                if (flow && isFlowIndicator(ch)) {
                    break;
                }
                if (ch == '#' && pos > segStart && isWhite(src.charAt(pos - 1))) {
                    break;
                }
                pos++;
            }
            int segEnd = pos;
            while (segEnd > segStart && isWhite(src.charAt(segEnd - 1))) {
                segEnd--;
            }
            if (segEnd > segStart) {
                if (pendingBreaks == 0) {
                    sb.append(' ');
                } else if (pendingBreaks > 0) {
                    sb.append("\n".repeat(pendingBreaks));
                }
                sb.append(src, segStart, segEnd);
                contentEnd = segEnd;
            }
            if (key || pos >= end || !isBreak(src.charAt(pos))) {
                break;
            }
            int p = pos;
            int breaks = 0;
            int q;
            while (true) {
                p = nextLineStart(src, p, end);
                q = p;
                while (q < end && isWhite(src.charAt(q))) {
                    q++;
                }
                if (q < end && isBreak(src.charAt(q))) {
                    breaks++;
                    p = q;
                    continue;
                }
                break;
            }
            if (q >= end) {
                break;
            }
            final int indent = q - p;
            final char first = src.charAt(q);
            if (indent <= parentIndent || (indent == 0 && isDocumentMarker(src, p, end)) || first == '#') {
                break;
            }
            if (flow && (isFlowIndicator(first) || first == ':')) {
                break;
            }
            pos = q;
            pendingBreaks = breaks;
        }
        lastEnd = contentEnd;
        buffer.add(new YamlEvent.Scalar(span(start, contentEnd), sb.toString(), YamlEvent.ScalarStyle.PLAIN, tag));
    }

    private static boolean cannotStartPlain(char c) {
        return switch (c) {
            case ',', '[', ']', '{', '}', '#', '&', '*', '!', '|', '>', '\'', '"', '%', '@', '`' -> true;
            default -> false;
        };
    }

    private void readQuoted(char quote, String tag) {
        final int start = pos;
        pos++;
        final StringBuilder sb = new StringBuilder();
        int keep = 0;
        while (true) {
            if (pos >= end) {
                throw error(YamlSyntaxException.Reason.UNTERMINATED_SCALAR,
                        "unexpected end of stream inside a quoted scalar", start);
            }
            final char c = src.charAt(pos);
            if (quote == '\'' && c == '\'') {
                if (pos + 1 < end && src.charAt(pos + 1) == '\'') {
                    sb.append('\'');
                    pos += 2;
                    keep = sb.length();
                    continue;
                }
                pos++;
                break;
            }
            if (quote == '"' && c == '"') {
                pos++;
                break;
            }
            if (quote == '"' && c == '\\') {
                if (pos + 1 < end && isBreak(src.charAt(pos + 1))) {
                    pos++;
                    consumeBreak();
                    while (true) {
                        skipWhite();
                        if (pos < end && isBreak(src.charAt(pos))) {
                            sb.append('\n');
                            consumeBreak();
                            continue;
                        }
                        break;
                    }
                    keep = sb.length();
                    checkQuotedContinuation(start);
                    continue;
                }
                pos = readEscape(sb, pos);
                keep = sb.length();
                continue;
            }
            if (isBreak(c)) {
                int len = sb.length();
                while (len > keep && isWhite(sb.charAt(len - 1))) {
                    len--;
                }
                sb.setLength(len);
                consumeBreak();
                int breaks = 0;
                while (true) {
                    skipWhite();
                    if (pos < end && isBreak(src.charAt(pos))) {
                        breaks++;
                        consumeBreak();
                        continue;
                    }
                    break;
                }
                checkQuotedContinuation(start);
                sb.append(breaks == 0 ? " " : "\n".repeat(breaks));
                keep = sb.length();
                continue;
            }
            sb.append(c);
            pos++;
        }
        lastEnd = pos;
        buffer.add(new YamlEvent.Scalar(span(start, pos), sb.toString(),
                quote == '"' ? YamlEvent.ScalarStyle.DOUBLE_QUOTED : YamlEvent.ScalarStyle.SINGLE_QUOTED, tag));
    }

    private void checkQuotedContinuation(int start) {
        if (pos >= end) {
            throw error(YamlSyntaxException.Reason.UNTERMINATED_SCALAR,
                    "unexpected end of stream inside a quoted scalar", start);
        }
        if (column(pos) == 0 && isDocumentMarker(src, pos, end)) {
            throw error(YamlSyntaxException.Reason.UNTERMINATED_SCALAR,
                    "document marker inside a quoted scalar", pos);
        }
    }

    /// Decodes the escape sequence at `p` (which holds the backslash) into `sb`.
    /// {@return the offset after the escape sequence}
    private int readEscape(StringBuilder sb, int p) {
        if (p + 1 >= end) {
            throw error(YamlSyntaxException.Reason.UNTERMINATED_SCALAR, "unexpected end of stream in an escape", p);
        }
        final char e = src.charAt(p + 1);
        switch (e) {
            case '0' -> sb.append('\0');
            case 'a' -> sb.append('\u0007');
            case 'b' -> sb.append('\b');
            case 't', '\t' -> sb.append('\t');
            case 'n' -> sb.append('\n');
            case 'v' -> sb.append('\u000B');
            case 'f' -> sb.append('\f');
            case 'r' -> sb.append('\r');
            case 'e' -> sb.append('\u001B');
            case ' ' -> sb.append(' ');
            case '"' -> sb.append('"');
            case '/' -> sb.append('/');
            case '\\' -> sb.append('\\');
            case 'N' -> sb.append('\u0085');
            case '_' -> sb.append('\u00A0');
            case 'L' -> sb.append('\u2028');
            case 'P' -> sb.append('\u2029');
            case 'x' -> {
                return readHexEscape(sb, p, 2);
            }
            case 'u' -> {
                return readHexEscape(sb, p, 4);
            }
            case 'U' -> {
                return readHexEscape(sb, p, 8);
            }
            default -> throw error(YamlSyntaxException.Reason.INVALID_ESCAPE,
                    "unknown escape sequence '\\" + e + "'", p);
        }
        return p + 2;
    }

    private int readHexEscape(StringBuilder sb, int p, int digits) {
        final int from = p + 2;
        if (from + digits > end) {
            throw error(YamlSyntaxException.Reason.INVALID_ESCAPE, "truncated escape sequence", p);
        }
        long cp = 0;
        for (int i = from; i < from + digits; i++) {
            final int d = Character.digit(src.charAt(i), 16);
            if (d < 0) {
                throw error(YamlSyntaxException.Reason.INVALID_ESCAPE,
                        "expected a hexadecimal digit in escape sequence", i);
            }
            cp = cp * 16 + d;
        }
        if (cp > Character.MAX_CODE_POINT) {
            throw error(YamlSyntaxException.Reason.INVALID_ESCAPE, "escaped code point out of range", p);
        }
        sb.appendCodePoint((int) cp);
        return from + digits;
    }

    private void readBlockScalar(int parentIndent, Props props) {
        final int start = pos;
        final boolean literal = src.charAt(pos) == '|';
        pos++;
        int chomp = 0;
        boolean chompSeen = false;
        int explicit = 0;
        for (int i = 0; i < 2 && pos < end; i++) {
            final char c = src.charAt(pos);
            if ((c == '+' || c == '-') && !chompSeen) {
                chomp = c == '+' ? 1 : -1;
                chompSeen = true;
                pos++;
            } else if (c >= '1' && c <= '9' && explicit == 0) {
                explicit = c - '0';
                pos++;
            } else if (c == '0') {
                throw error(YamlSyntaxException.Reason.INVALID_BLOCK_HEADER,
                        "block scalar indentation indicator must be between 1 and 9", pos);
            } else {
                break;
            }
        }
        if (!isBlankAt(src, pos, end)) {
            throw error(YamlSyntaxException.Reason.INVALID_BLOCK_HEADER,
                    "unexpected character in a block scalar header", pos);
        }
        skipWhite();
        skipComment();
        final int headerEnd = pos;
        if (pos < end) {
            consumeBreak();
        }
        emitProps(props);

        final int contentIndent = explicit > 0 ? Math.max(parentIndent, 0) + explicit : detectBlockIndent(parentIndent);
        final StringBuilder sb = new StringBuilder();
        int emptyLines = 0;
        boolean didRead = false;
        boolean moreIndented = false;
        boolean lastHadBreak = false;
        int contentEnd = headerEnd;
        while (pos < end) {
            final int ls = pos;
            if (isDocumentMarker(src, ls, end)) {
                break;
            }
            int s = 0;
            while (s < contentIndent && ls + s < end && src.charAt(ls + s) == ' ') {
                s++;
            }
            final int q = ls + s;
            if (q >= end) {
                pos = q;
                break;
            }
            if (isBreak(src.charAt(q))) {
                emptyLines++;
                pos = q;
                consumeBreak();
                continue;
            }
            if (s < contentIndent) {
                pos = ls;
                break;
            }
            final int le = lineEnd(src, q, end);
            if (literal) {
                sb.append("\n".repeat(didRead ? 1 + emptyLines : emptyLines));
            } else if (isWhite(src.charAt(q))) {
                moreIndented = true;
                sb.append("\n".repeat(didRead ? 1 + emptyLines : emptyLines));
            } else if (moreIndented) {
                moreIndented = false;
                sb.append("\n".repeat(emptyLines + 1));
            } else if (emptyLines == 0) {
                if (didRead) {
                    sb.append(' ');
                }
            } else {
                sb.append("\n".repeat(emptyLines));
            }
            sb.append(src, q, le);
            didRead = true;
            emptyLines = 0;
            contentEnd = le;
            pos = le;
            lastHadBreak = pos < end;
            if (pos < end) {
                consumeBreak();
            }
        }
        if (chomp > 0) {
            sb.append("\n".repeat(didRead ? (lastHadBreak ? 1 : 0) + emptyLines : emptyLines));
        } else if (chomp == 0 && didRead && lastHadBreak) {
            sb.append('\n');
        }
        lastEnd = contentEnd;
        buffer.add(new YamlEvent.Scalar(span(start, contentEnd), sb.toString(),
                literal ? YamlEvent.ScalarStyle.LITERAL : YamlEvent.ScalarStyle.FOLDED, props.tag()));
    }

    private int detectBlockIndent(int parentIndent) {
        int p = pos;
        int maxBlank = 0;
        while (p < end) {
            final int s = indentation(src, p, end);
            final int q = p + s;
            if (q >= end) {
                maxBlank = Math.max(maxBlank, s);
                break;
            }
            if (isBreak(src.charAt(q))) {
                maxBlank = Math.max(maxBlank, s);
                p = nextLineStart(src, q, end);
                continue;
            }
            if (s == 0 && isDocumentMarker(src, p, end)) {
                break;
            }
            if (s > parentIndent) {
                if (maxBlank > s) {
                    throw error(YamlSyntaxException.Reason.BAD_INDENTATION,
                            "leading empty lines of a block scalar are indented more than its first line", p);
                }
                return s;
            }
            break;
        }
        return Math.max(parentIndent + 1, maxBlank);
    }

    // ---------------------------------------------------------------- low level

    private void emitProps(Props props) {
        if (props.anchor() != null) {
            buffer.add(new YamlEvent.Anchor(props.anchorSpan(), props.anchor()));
        }
    }

    private void emitEmpty(Props props, int at) {
        emitProps(props);
        buffer.add(new YamlEvent.Scalar(Span.at(loc(at)), "", YamlEvent.ScalarStyle.PLAIN, props.tag()));
    }

    private Props merge(Props outer, Props inner) {
        if (outer.isEmpty()) {
            return inner;
        }
        if (inner.isEmpty()) {
            return outer;
        }
        if ((outer.anchor() != null && inner.anchor() != null) || (outer.tag() != null && inner.tag() != null)) {
            throw error(YamlSyntaxException.Reason.UNEXPECTED_CHARACTER,
                    "a node may have at most one anchor and one tag", inner.start());
        }
        return new Props(outer.anchor() != null ? outer.anchor() : inner.anchor(),
                outer.anchor() != null ? outer.anchorSpan() : inner.anchorSpan(),
                outer.tag() != null ? outer.tag() : inner.tag(),
                outer.start());
    }

    private void enter() {
        if (++depth > MAX_DEPTH) {
            throw error(YamlSyntaxException.Reason.DEPTH_LIMIT,
                    "maximum nesting depth of " + MAX_DEPTH + " exceeded", pos);
        }
    }

    private void exit() {
        depth--;
    }

    private void closeOpen(int target) {
        while (open.size() > target) {
            final char kind = open.pop();
            final Span at = Span.at(loc(pos));
            buffer.add(kind == 'M' ? new YamlEvent.MappingEnd(at) : new YamlEvent.SequenceEnd(at));
        }
    }

    /// Moves to the next line, after the entry that failed, whose content is indented no deeper
    /// than `indent`, or to the next document marker.
    private void skipToResyncPoint(int indent, int entryStart, int errorOffset) {
        int p = Math.max(lines.lineStart(Math.min(errorOffset, end)), nextLineStart(src, entryStart, end));
        while (p < end) {
            if (isDocumentMarker(src, p, end)) {
                break;
            }
            if (!isBlankOrCommentLine(src, p, end)) {
                int q = p;
                while (q < end && isWhite(src.charAt(q))) {
                    q++;
                }
                if (q - p <= indent) {
                    pos = q;
                    return;
                }
            }
            p = nextLineStart(src, p, end);
        }
        pos = p;
    }

    private void skipToDocumentBoundary() {
        if (!(column(pos) == 0 && isDocumentMarker(src, pos, end))) {
            pos = nextLineStart(src, pos, end);
        }
        while (pos < end && !isDocumentMarker(src, pos, end)) {
            pos = nextLineStart(src, pos, end);
        }
    }

    /// Skips whitespace, comments and line breaks in block context. A tab in the indentation of
    /// a line with content is a problem.
    private void skipToContent() {
        boolean lineStart = column(pos) == 0;
        while (pos < end) {
            if (lineStart) {
                checkIndentation();
                lineStart = false;
            }
            skipWhite();
            skipComment();
            if (pos < end && isBreak(src.charAt(pos))) {
                consumeBreak();
                lineStart = true;
                continue;
            }
            break;
        }
    }

    private void checkIndentation() {
        int p = pos;
        while (p < end && src.charAt(p) == ' ') {
            p++;
        }
        if (p >= end || src.charAt(p) != '\t') {
            return;
        }
        int q = p;
        while (q < end && isWhite(src.charAt(q))) {
            q++;
        }
        if (q < end && !isBreak(src.charAt(q)) && src.charAt(q) != '#') {
            problem(YamlSyntaxException.Reason.TAB_INDENTATION, "tab characters must not be used in indentation", p);
        }
    }

    private void skipWhite() {
        while (pos < end && isWhite(src.charAt(pos))) {
            pos++;
        }
    }

    private void skipComment() {
        if (pos < end && src.charAt(pos) == '#') {
            pos = lineEnd(src, pos, end);
        }
    }

    private void consumeBreak() {
        if (pos < end && src.charAt(pos) == '\r') {
            pos++;
        }
        if (pos < end && src.charAt(pos) == '\n') {
            pos++;
        }
    }

    private boolean atLineEnd() {
        return pos >= end || isBreak(src.charAt(pos));
    }

    private boolean atDocumentMarker() {
        return column(pos) == 0 && isDocumentMarker(src, pos, end);
    }

    private boolean atSequenceIndicator() {
        return peek() == '-' && isBlankAt(src, pos + 1, end);
    }

    private boolean atExplicitKey() {
        return peek() == '?' && isBlankAt(src, pos + 1, end);
    }

    private char peek() {
        return pos < end ? src.charAt(pos) : '\0';
    }

    private int column(int offset) {
        return lines.column(offset);
    }

    private Location loc(int offset) {
        return lines.location(Math.min(offset, end));
    }

    private Span span(int from, int to) {
        return new Span(loc(from), loc(to));
    }

    private YamlSyntaxException error(YamlSyntaxException.Reason reason, String message, int offset) {
        return new YamlSyntaxException(reason, message, loc(offset));
    }

    /// A problem that does not disturb the structure being scanned: thrown in `FAIL_FAST`,
    /// recorded in `COLLECT` without resynchronizing.
    private void problem(YamlSyntaxException.Reason reason, String message, int offset) {
        final YamlSyntaxException ex = error(reason, message, offset);
        if (mode == ErrorMode.FAIL_FAST) {
            throw ex;
        }
        record(ex);
    }

    private void record(YamlSyntaxException ex) {
        for (YamlSyntaxException seen : problems) {
            if (seen.location().offset() == ex.location().offset() && seen.reason() == ex.reason()) {
                return;
            }
            if (ex.reason() == YamlSyntaxException.Reason.BAD_INDENTATION
                    && seen.reason() == YamlSyntaxException.Reason.TAB_INDENTATION
                    && seen.location().line() == ex.location().line()) {
                return;
            }
        }
        LOG.finer(() -> "recorded syntax problem: " + ex.getMessage());
        problems.add(ex);
    }

    /// Anchor and tag read before a node. `start` is the offset of the first property.
    private record Props(String anchor, Span anchorSpan, String tag, int start) {
        static final Props NONE = new Props(null, null, null, -1);

        boolean isEmpty() {
            return start < 0;
        }
    }
}
