package yaml.java17;

import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.logging.Logger;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/// This class provides static methods for parsing YAML text into a {@link YamlValue} graph and
/// for writing a graph back as YAML text.
///
/// Parsing follows YAML 1.2.2 with the Core Schema and is fail-fast: the first malformed
/// construct raises a {@link YamlSyntaxException}, the first duplicate key, undefined alias,
/// redefined anchor or ill-typed tagged scalar raises a {@link YamlSemanticException}.
///
/// ## Example Usage
/// ```java
/// YamlValue config = Yaml.parse("""
///     server:
///       host: localhost
///       ports: [8080, 8443]
///     """);
/// String host = config.get("server").get("host").string();
///
/// String text = Yaml.serialize(config, EmitterOptions.defaults().withSortKeys(true));
/// ```
public final class Yaml {

    private static final Logger LOG = Logger.getLogger(Yaml.class.getName());

    private Yaml() {}

    /// Parses a single-document YAML source.
    ///
    /// An empty, blank, comment-only or `---`-only source yields {@link YamlNull}.
    ///
    /// @param source the YAML text. Non-null.
    /// @throws YamlSyntaxException   if the text is malformed, or holds more than one document
    ///                               (`Reason.MULTIPLE_DOCUMENTS`)
    /// @throws YamlSemanticException if the text does not compose into a valid value graph
    /// @return the root value
    public static YamlValue parse(String source) {
        Objects.requireNonNull(source, "source must not be null");
        LOG.fine(() -> "parse chars=" + source.length());
        final YamlComposer composer = new YamlComposer(new YamlScanner(source, ErrorMode.FAIL_FAST),
                ErrorMode.FAIL_FAST);
        final Optional<YamlDocument> document = composer.nextDocument();
        final Span next = composer.nextDocumentSpan();
        if (next != null) {
            throw new YamlSyntaxException(YamlSyntaxException.Reason.MULTIPLE_DOCUMENTS,
                    "expected a single document in the stream but found another document", next.start());
        }
        return document.map(YamlDocument::root).orElse(YamlNull.of());
    }

    /// Parses a single-document YAML source given as UTF-8 bytes.
    public static YamlValue parse(byte[] utf8) {
        Objects.requireNonNull(utf8, "utf8 must not be null");
        return parse(new String(utf8, StandardCharsets.UTF_8));
    }

    /// Parses every document of a YAML stream lazily, in order.
    ///
    /// The stream is one-shot; a document is scanned only when the stream reaches it, and a
    /// malformed document raises when it is reached. An empty source yields an empty stream.
    public static Stream<YamlValue> parseAll(String source) {
        return documents(source).map(YamlDocument::root);
    }

    /// Parses every document of a YAML stream eagerly, with spans and marker flags.
    public static List<YamlDocument> parseDocuments(String source) {
        Objects.requireNonNull(source, "source must not be null");
        LOG.fine(() -> "parseDocuments chars=" + source.length());
        return new YamlComposer(new YamlScanner(source, ErrorMode.FAIL_FAST), ErrorMode.FAIL_FAST).composeAll();
    }

    private static Stream<YamlDocument> documents(String source) {
        Objects.requireNonNull(source, "source must not be null");
        LOG.fine(() -> "parseAll chars=" + source.length());
        final YamlComposer composer = new YamlComposer(new YamlScanner(source, ErrorMode.FAIL_FAST),
                ErrorMode.FAIL_FAST);
        final Iterator<YamlDocument> iterator = new Iterator<>() {
            @Override
            public boolean hasNext() {
                return composer.hasMoreDocuments();
            }

            @Override
            public YamlDocument next() {
                return composer.nextDocument().orElseThrow(NoSuchElementException::new);
            }
        };
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator,
                Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /// Serializes a value as one YAML document with default options.
    public static String serialize(YamlValue value) {
        return serialize(value, EmitterOptions.defaults());
    }

    /// Serializes a value as one YAML document.
    ///
    /// `parse(serialize(value, options))` is structurally equal to `value` for every options.
    ///
    /// @throws YamlEmitException if the value nests deeper than the parser accepts
    public static String serialize(YamlValue value, EmitterOptions options) {
        return new YamlEmitter(options).emit(value);
    }

    /// Serializes values as a multi-document YAML stream.
    public static String serializeAll(List<? extends YamlValue> values, EmitterOptions options) {
        return new YamlEmitter(options).emitAll(values);
    }

    /// Re-emits every document of a YAML source in the emitter's canonical layout.
    ///
    /// Comments and source styles are not preserved.
    public static String format(String source, EmitterOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        final List<YamlValue> roots = parseDocuments(source).stream().map(YamlDocument::root).toList();
        return serializeAll(roots, options);
    }
}
