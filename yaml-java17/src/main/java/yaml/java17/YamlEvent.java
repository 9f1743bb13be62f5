package yaml.java17;

import java.util.Objects;

/// Lexical events produced by {@link YamlScanner} and consumed by {@link YamlComposer}.
///
/// Every event carries the span of source text it was scanned from. An empty node (for example
/// the value of `key:`) is a plain `Scalar` with an empty value and a zero-width span.
public sealed interface YamlEvent {

    Span span();

    /// Style of a collection in the source text.
    enum CollectionStyle { BLOCK, FLOW }

    /// Style of a scalar in the source text.
    enum ScalarStyle { PLAIN, SINGLE_QUOTED, DOUBLE_QUOTED, LITERAL, FOLDED }

    record StreamStart(Span span) implements YamlEvent {}

    record StreamEnd(Span span) implements YamlEvent {}

    record DocumentStart(Span span, boolean explicit) implements YamlEvent {}

    record DocumentEnd(Span span, boolean explicit) implements YamlEvent {}

    /// @param tag the resolved tag (`tag:yaml.org,2002:map`, `!local`, ...) or null
    record MappingStart(Span span, CollectionStyle style, String tag) implements YamlEvent {}

    record MappingEnd(Span span) implements YamlEvent {}

    record SequenceStart(Span span, CollectionStyle style, String tag) implements YamlEvent {}

    record SequenceEnd(Span span) implements YamlEvent {}

    record Scalar(Span span, String value, ScalarStyle style, String tag) implements YamlEvent {
        public Scalar {
            Objects.requireNonNull(value, "value must not be null");
            Objects.requireNonNull(style, "style must not be null");
        }

        /// {@return true for the empty node that stands in for an omitted value}
        public boolean isEmptyNode() {
            return style == ScalarStyle.PLAIN && value.isEmpty();
        }
    }

    record Alias(Span span, String name) implements YamlEvent {}

    /// Names the node whose start event follows immediately.
    record Anchor(Span span, String name) implements YamlEvent {}
}
