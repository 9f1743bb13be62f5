package yaml.java17;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Builds {@link YamlDocument}s from a {@link YamlEvent} stream.
///
/// Anchors live in a per-document table that is cleared at every document start. An alias
/// resolves only to an anchor whose node is complete: an alias to an anchor still being
/// composed (a recursive reference) is reported like an undefined alias.
///
/// Untagged plain scalars are resolved by {@link CoreSchema}; quoted and block scalars are
/// strings. The Core Schema tags `!!str`, `!!int`, `!!float`, `!!bool` and `!!null` force the
/// kind of a scalar, `!` forces a string, and `!!seq` / `!!map` must name the collection they
/// tag. Any other tag is kept out of the value graph.
public final class YamlComposer {

    private static final Logger LOG = Logger.getLogger(YamlComposer.class.getName());

    private final Iterator<YamlEvent> events;
    private final ErrorMode mode;
    private final List<YamlSemanticException> problems = new ArrayList<>();

    private final Map<String, Anchored> anchors = new HashMap<>();
    private final Set<String> openAnchors = new HashSet<>();
    private YamlEvent peeked;

    public YamlComposer(Iterator<YamlEvent> events, ErrorMode mode) {
        this.events = Objects.requireNonNull(events, "events must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
    }

    /// {@return the problems recorded so far in `COLLECT` mode}
    public List<YamlSemanticException> problems() {
        return List.copyOf(problems);
    }

    /// {@return true if another document follows in the event stream}
    public boolean hasMoreDocuments() {
        return peekDocument() instanceof YamlEvent.DocumentStart;
    }

    /// {@return the span of the next document's start event, or null if there is none}
    Span nextDocumentSpan() {
        return peekDocument() instanceof YamlEvent.DocumentStart start ? start.span() : null;
    }

    /// Composes the next document, or returns empty at the end of the stream.
    public Optional<YamlDocument> nextDocument() {
        final YamlEvent first = peekDocument();
        if (first == null || first instanceof YamlEvent.StreamEnd) {
            return Optional.empty();
        }
        final YamlEvent.DocumentStart start = expect(YamlEvent.DocumentStart.class);
        anchors.clear();
        openAnchors.clear();
        final YamlValue root = peek() instanceof YamlEvent.DocumentEnd ? YamlNull.of() : composeNode().value();
        final YamlEvent.DocumentEnd end = expect(YamlEvent.DocumentEnd.class);
        LOG.finer(() -> "composed document at " + start.span().start() + " root kind=" + root.kind());
        return Optional.of(new YamlDocument(root, new Span(start.span().start(), end.span().end()),
                start.explicit(), end.explicit()));
    }

    /// Composes every remaining document.
    public List<YamlDocument> composeAll() {
        final List<YamlDocument> documents = new ArrayList<>();
        Optional<YamlDocument> next;
        while ((next = nextDocument()).isPresent()) {
            documents.add(next.get());
        }
        return documents;
    }

    private YamlEvent peekDocument() {
        if (peek() instanceof YamlEvent.StreamStart) {
            take();
        }
        return peek();
    }

    private YamlEvent peek() {
        if (peeked == null && events.hasNext()) {
            peeked = events.next();
        }
        return peeked;
    }

    private YamlEvent take() {
        final YamlEvent event = peek();
        if (event == null) {
            throw new IllegalStateException("unexpected end of the event stream");
        }
        peeked = null;
        return event;
    }

    private <T extends YamlEvent> T expect(Class<T> type) {
        final YamlEvent event = take();
        if (!type.isInstance(event)) {
            throw new IllegalStateException("expected " + type.getSimpleName() + " but got " + event);
        }
        return type.cast(event);
    }

    private static boolean isEnd(YamlEvent event) {
        return event == null
                || event instanceof YamlEvent.MappingEnd
                || event instanceof YamlEvent.SequenceEnd
                || event instanceof YamlEvent.DocumentEnd;
    }

    private Node composeNode() {
        YamlEvent event = take();
        YamlEvent.Anchor anchor = null;
        if (event instanceof YamlEvent.Anchor a) {
            anchor = a;
            if (isEnd(peek())) {
                // anchor left behind by scanner recovery
                return new Node(YamlNull.of(), a.span());
            }
            event = take();
            defineAnchor(a);
        }
        final Node node;
        if (event instanceof YamlEvent.Scalar scalar) {
            node = new Node(resolveScalar(scalar), scalar.span());
        } else if (event instanceof YamlEvent.Alias alias) {
            node = new Node(resolveAlias(alias), alias.span());
        } else if (event instanceof YamlEvent.SequenceStart seq) {
            node = composeSequence(seq);
        } else if (event instanceof YamlEvent.MappingStart map) {
            node = composeMapping(map);
        } else {
            throw new IllegalStateException("unexpected event " + event);
        }
        if (anchor != null) {
            openAnchors.remove(anchor.name());
            anchors.put(anchor.name(), new Anchored(node.value(), anchor.span()));
        }
        return node;
    }

    private void defineAnchor(YamlEvent.Anchor anchor) {
        final Anchored previous = anchors.get(anchor.name());
        if (previous != null || openAnchors.contains(anchor.name())) {
            report(new YamlSemanticException(YamlSemanticException.Reason.DUPLICATE_ANCHOR,
                    "anchor '" + anchor.name() + "' is already defined in this document",
                    anchor.span(), previous == null ? null : previous.span()));
        }
        openAnchors.add(anchor.name());
    }

    private YamlValue resolveAlias(YamlEvent.Alias alias) {
        final Anchored target = anchors.get(alias.name());
        if (target != null && !openAnchors.contains(alias.name())) {
            return target.value();
        }
        final String problem = openAnchors.contains(alias.name())
                ? "alias '*" + alias.name() + "' refers to a node that is not complete"
                : "undefined alias '*" + alias.name() + "'";
        report(new YamlSemanticException(YamlSemanticException.Reason.UNDEFINED_ALIAS, problem, alias.span()));
        return YamlNull.of();
    }

    private Node composeSequence(YamlEvent.SequenceStart start) {
        final List<YamlValue> values = new ArrayList<>();
        while (!(peek() instanceof YamlEvent.SequenceEnd)) {
            if (isEnd(peek())) {
                throw new IllegalStateException("unbalanced sequence at " + start.span().start());
            }
            values.add(composeNode().value());
        }
        final YamlEvent end = take();
        final Span span = new Span(start.span().start(), end.span().end());
        checkCollectionTag(start.tag(), CoreSchema.SEQ, span);
        return new Node(YamlSequence.of(values), span);
    }

    private Node composeMapping(YamlEvent.MappingStart start) {
        final List<YamlMapping.Entry> entries = new ArrayList<>();
        final Map<YamlValue, Span> keySpans = new HashMap<>();
        while (!(peek() instanceof YamlEvent.MappingEnd)) {
            if (isEnd(peek())) {
                throw new IllegalStateException("unbalanced mapping at " + start.span().start());
            }
            final Node key = composeNode();
            final YamlValue value = peek() instanceof YamlEvent.MappingEnd ? YamlNull.of() : composeNode().value();
            final Span first = keySpans.get(key.value());
            if (first != null) {
                report(new YamlSemanticException(YamlSemanticException.Reason.DUPLICATE_KEY,
                        "duplicate key " + describeKey(key.value()) + " (first defined at line "
                                + first.start().line() + ")",
                        key.span(), first));
                continue;
            }
            keySpans.put(key.value(), key.span());
            entries.add(new YamlMapping.Entry(key.value(), value));
        }
        final YamlEvent end = take();
        final Span span = new Span(start.span().start(), end.span().end());
        checkCollectionTag(start.tag(), CoreSchema.MAP, span);
        return new Node(YamlMapping.of(entries), span);
    }

    private static String describeKey(YamlValue key) {
        return key instanceof YamlString s ? "'" + s.value() + "'" : key.toString();
    }

    private void checkCollectionTag(String tag, String expected, Span span) {
        if (tag == null || tag.equals(expected) || !tag.startsWith(CoreSchema.TAG_PREFIX)) {
            return;
        }
        if (isCoreTag(tag)) {
            report(new YamlSemanticException(YamlSemanticException.Reason.INVALID_TAGGED_VALUE,
                    "a " + (expected.equals(CoreSchema.SEQ) ? "sequence" : "mapping")
                            + " cannot be tagged " + shortTag(tag), span));
        }
    }

    private YamlValue resolveScalar(YamlEvent.Scalar scalar) {
        final String tag = scalar.tag();
        final String text = scalar.value();
        if (tag == null) {
            return scalar.style() == YamlEvent.ScalarStyle.PLAIN ? CoreSchema.resolvePlain(text) : YamlString.of(text);
        }
        if (tag.equals("!") || tag.equals(CoreSchema.STR)) {
            return YamlString.of(text);
        }
        if (!isCoreTag(tag)) {
            LOG.finest(() -> "ignoring unrecognized tag " + tag);
            return scalar.style() == YamlEvent.ScalarStyle.PLAIN ? CoreSchema.resolvePlain(text) : YamlString.of(text);
        }
        final YamlValue forced = forceScalar(tag, text);
        if (forced != null) {
            return forced;
        }
        report(new YamlSemanticException(YamlSemanticException.Reason.INVALID_TAGGED_VALUE,
                "value '" + text + "' is not a valid " + shortTag(tag), scalar.span()));
        return scalar.style() == YamlEvent.ScalarStyle.PLAIN ? CoreSchema.resolvePlain(text) : YamlString.of(text);
    }

    /// {@return the value of `text` under a Core Schema tag, or null if it does not fit}
    private static YamlValue forceScalar(String tag, String text) {
        switch (tag.substring(CoreSchema.TAG_PREFIX.length())) {
            case "null":
                return CoreSchema.isNull(text) ? YamlNull.of() : null;
            case "bool":
                return "true".equals(text) ? YamlBool.of(true) : "false".equals(text) ? YamlBool.of(false) : null;
            case "int":
                return CoreSchema.parseInt(text).map(YamlInt::of).orElse(null);
            case "float":
                final Optional<Double> real = CoreSchema.parseFloat(text);
                if (real.isPresent()) {
                    return YamlFloat.of(real.get());
                }
                return CoreSchema.parseInt(text).map(BigInteger::doubleValue).map(YamlFloat::of).orElse(null);
            default:
                return null;
        }
    }

    private static boolean isCoreTag(String tag) {
        return tag.equals(CoreSchema.STR) || tag.equals(CoreSchema.INT) || tag.equals(CoreSchema.FLOAT)
                || tag.equals(CoreSchema.BOOL) || tag.equals(CoreSchema.NULL)
                || tag.equals(CoreSchema.SEQ) || tag.equals(CoreSchema.MAP);
    }

    private static String shortTag(String tag) {
        return tag.startsWith(CoreSchema.TAG_PREFIX) ? "!!" + tag.substring(CoreSchema.TAG_PREFIX.length()) : tag;
    }

    private void report(YamlSemanticException ex) {
        if (mode == ErrorMode.FAIL_FAST) {
            throw ex;
        }
        LOG.finer(() -> "recorded semantic problem: " + ex.getMessage());
        problems.add(ex);
    }

    private record Node(YamlValue value, Span span) {}

    private record Anchored(YamlValue value, Span span) {}
}
