package yaml.java17;

import java.util.Objects;
import java.util.Optional;

/// A well-formed event stream that does not compose into a valid value graph:
/// duplicate keys, undefined aliases, redefined anchors, tagged values that do not fit their tag.
public final class YamlSemanticException extends YamlException {

    private static final long serialVersionUID = 1L;

    private final String problem;
    private final Span span;
    private final Span related;
    private final Reason reason;

    public YamlSemanticException(Reason reason, String problem, Span span) {
        this(reason, problem, span, null);
    }

    /// @param related an earlier span the problem refers to (the first occurrence of a duplicate
    ///                key, the first definition of an anchor), or null
    public YamlSemanticException(Reason reason, String problem, Span span, Span related) {
        super(problem + " at line " + Objects.requireNonNull(span, "span").start().line()
                + ", column " + span.start().column());
        this.reason = Objects.requireNonNull(reason, "reason");
        this.problem = Objects.requireNonNull(problem, "problem");
        this.span = span;
        this.related = related;
    }

    @Override
    public String problem() {
        return problem;
    }

    public Span span() {
        return span;
    }

    public Optional<Span> related() {
        return Optional.ofNullable(related);
    }

    public Reason reason() {
        return reason;
    }

    public enum Reason {
        DUPLICATE_KEY,
        UNDEFINED_ALIAS,
        DUPLICATE_ANCHOR,
        INVALID_TAGGED_VALUE
    }
}
