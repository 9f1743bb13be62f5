package yaml.java17.lint;

import yaml.java17.ErrorMode;
import yaml.java17.Location;
import yaml.java17.Span;
import yaml.java17.YamlComposer;
import yaml.java17.YamlDocument;
import yaml.java17.YamlEvent;
import yaml.java17.YamlScanner;
import yaml.java17.YamlSemanticException;
import yaml.java17.YamlSyntaxException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Everything the rules look at for one source: the text split into lines, the events the
/// scanner produced, the composed documents and the problems both stages recorded.
///
/// The scanner and composer run in {@link ErrorMode#COLLECT}, so a context exists for any input.
public final class LintContext {

    private static final Logger LOG = Logger.getLogger(LintContext.class.getName());

    /// Where a node sits in its parent.
    public enum Role { ROOT, KEY, VALUE, ELEMENT }

    /// A node event (scalar, alias, collection start) with its place in the tree.
    ///
    /// @param parent the enclosing collection's node, null for a root
    /// @param key    for a `VALUE`, the node of its key; null otherwise
    /// @param anchor the anchor event that named this node, or null
    public record Node(YamlEvent event, Role role, Node parent, Node key, YamlEvent.Anchor anchor) {

        public Span span() {
            return event.span();
        }

        public boolean isBlockCollection() {
            return event instanceof YamlEvent.MappingStart m && m.style() == YamlEvent.CollectionStyle.BLOCK
                    || event instanceof YamlEvent.SequenceStart s && s.style() == YamlEvent.CollectionStyle.BLOCK;
        }
    }

    private final String source;
    private final LintConfig config;
    private final int[] lineStarts;
    private final List<YamlEvent> events;
    private final List<Node> nodes;
    private final List<YamlDocument> documents;
    private final List<YamlSyntaxException> syntaxProblems;
    private final List<YamlSemanticException> semanticProblems;

    private LintContext(String source, LintConfig config, List<YamlEvent> events, List<YamlDocument> documents,
                        List<YamlSyntaxException> syntaxProblems, List<YamlSemanticException> semanticProblems) {
        this.source = source;
        this.config = config;
        this.lineStarts = lineStarts(source);
        this.events = List.copyOf(events);
        this.nodes = List.copyOf(index(events));
        this.documents = List.copyOf(documents);
        this.syntaxProblems = List.copyOf(syntaxProblems);
        this.semanticProblems = List.copyOf(semanticProblems);
    }

    /// Scans and composes `source`, recording every event on the way.
    public static LintContext analyze(String source, LintConfig config) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(config, "config must not be null");
        final YamlScanner scanner = new YamlScanner(source, ErrorMode.COLLECT);
        final List<YamlEvent> events = new ArrayList<>();
        final Iterator<YamlEvent> recording = new Iterator<>() {
            @Override
            public boolean hasNext() {
                return scanner.hasNext();
            }

            @Override
            public YamlEvent next() {
                final YamlEvent event = scanner.next();
                events.add(event);
                return event;
            }
        };
        final YamlComposer composer = new YamlComposer(recording, ErrorMode.COLLECT);
        final List<YamlDocument> documents = composer.composeAll();
        recording.forEachRemaining(event -> { });
        LOG.finer(() -> "analyzed events=" + events.size() + " documents=" + documents.size()
                + " syntaxProblems=" + scanner.problems().size() + " semanticProblems=" + composer.problems().size());
        return new LintContext(source, config, events, documents, scanner.problems(), composer.problems());
    }

    public String source() {
        return source;
    }

    public LintConfig config() {
        return config;
    }

    public List<YamlEvent> events() {
        return events;
    }

    /// {@return every node in document order}
    public List<Node> nodes() {
        return nodes;
    }

    public List<YamlDocument> documents() {
        return documents;
    }

    public List<YamlSyntaxException> syntaxProblems() {
        return syntaxProblems;
    }

    public List<YamlSemanticException> semanticProblems() {
        return semanticProblems;
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /// {@return the offset of the first char of a 1-based line}
    public int lineStart(int line) {
        return lineStarts[line - 1];
    }

    /// {@return the text of a 1-based line without its line break}
    public String line(int line) {
        final int start = lineStart(line);
        int end = start;
        while (end < source.length() && source.charAt(end) != '\n' && source.charAt(end) != '\r') {
            end++;
        }
        return source.substring(start, end);
    }

    public Location location(int offset) {
        int idx = Arrays.binarySearch(lineStarts, offset);
        if (idx < 0) {
            idx = -idx - 2;
        }
        return new Location(idx + 1, offset - lineStarts[idx] + 1, offset);
    }

    public Span span(int from, int to) {
        return new Span(location(from), location(to));
    }

    /// {@return a diagnostic of `rule` with its default severity}
    public Diagnostic diagnostic(LintRule rule, String message, Span span) {
        return new Diagnostic(rule.id(), rule.defaultSeverity(), message, span);
    }

    /// {@return true if only spaces precede `offset` on its line}
    public boolean startsLine(int offset) {
        final int lineStart = lineStart(location(offset).line());
        for (int i = lineStart; i < offset; i++) {
            if (source.charAt(i) != ' ') {
                return false;
            }
        }
        return true;
    }

    private static int[] lineStarts(String source) {
        int[] starts = new int[16];
        int n = 0;
        starts[n++] = 0;
        for (int i = 0; i < source.length(); i++) {
            final char c = source.charAt(i);
            if (c == '\n' || (c == '\r' && (i + 1 >= source.length() || source.charAt(i + 1) != '\n'))) {
                if (i + 1 >= source.length()) {
                    break;
                }
                if (n == starts.length) {
                    starts = Arrays.copyOf(starts, n * 2);
                }
                starts[n++] = i + 1;
            }
        }
        return Arrays.copyOf(starts, n);
    }

    private static List<Node> index(List<YamlEvent> events) {
        final List<Node> nodes = new ArrayList<>();
        final Deque<Frame> frames = new ArrayDeque<>();
        YamlEvent.Anchor anchor = null;
        for (YamlEvent event : events) {
            if (event instanceof YamlEvent.Anchor a) {
                anchor = a;
                continue;
            }
            if (event instanceof YamlEvent.MappingEnd || event instanceof YamlEvent.SequenceEnd) {
                if (!frames.isEmpty()) {
                    frames.pop();
                }
                anchor = null;
                continue;
            }
            if (event instanceof YamlEvent.DocumentStart) {
                frames.clear();
                anchor = null;
                continue;
            }
            if (!(event instanceof YamlEvent.Scalar || event instanceof YamlEvent.Alias
                    || event instanceof YamlEvent.MappingStart || event instanceof YamlEvent.SequenceStart)) {
                continue;
            }
            final Frame frame = frames.peek();
            final Node node;
            if (frame == null) {
                node = new Node(event, Role.ROOT, null, null, anchor);
            } else if (frame.mapping) {
                final boolean isKey = frame.children % 2 == 0;
                node = new Node(event, isKey ? Role.KEY : Role.VALUE, frame.node, isKey ? null : frame.lastKey, anchor);
                if (isKey) {
                    frame.lastKey = node;
                }
                frame.children++;
            } else {
                node = new Node(event, Role.ELEMENT, frame.node, null, anchor);
                frame.children++;
            }
            anchor = null;
            nodes.add(node);
            if (event instanceof YamlEvent.MappingStart || event instanceof YamlEvent.SequenceStart) {
                frames.push(new Frame(node, event instanceof YamlEvent.MappingStart));
            }
        }
        return nodes;
    }

    private static final class Frame {
        final Node node;
        final boolean mapping;
        int children;
        Node lastKey;

        Frame(Node node, boolean mapping) {
            this.node = node;
            this.mapping = mapping;
        }
    }
}
