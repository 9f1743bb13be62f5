package yaml.java17.lint;

import yaml.java17.Span;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// One finding of the linter.
///
/// @param ruleId      the id of the rule that reported it, e.g. `duplicate-key`
/// @param severity    the effective severity after configuration overrides
/// @param message     a one-line description
/// @param span        the primary source range
/// @param labels      secondary ranges with their own messages
/// @param suggestions proposed fixes
public record Diagnostic(String ruleId, Severity severity, String message, Span span,
                         List<Label> labels, List<Suggestion> suggestions) {

    public Diagnostic {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(span, "span must not be null");
        labels = List.copyOf(labels);
        suggestions = List.copyOf(suggestions);
    }

    public Diagnostic(String ruleId, Severity severity, String message, Span span) {
        this(ruleId, severity, message, span, List.of(), List.of());
    }

    public Diagnostic withLabel(Span span, String message) {
        final List<Label> more = new ArrayList<>(labels);
        more.add(new Label(span, message));
        return new Diagnostic(ruleId, severity, this.message, this.span, more, suggestions);
    }

    public Diagnostic withSuggestion(String message, Span span, String replacement) {
        final List<Suggestion> more = new ArrayList<>(suggestions);
        more.add(new Suggestion(message, span, replacement));
        return new Diagnostic(ruleId, severity, this.message, this.span, labels, more);
    }

    public Diagnostic withSeverity(Severity severity) {
        return new Diagnostic(ruleId, severity, message, span, labels, suggestions);
    }

    /// A secondary source range, such as the first occurrence of a duplicated key.
    public record Label(Span span, String message) {
        public Label {
            Objects.requireNonNull(span, "span must not be null");
            Objects.requireNonNull(message, "message must not be null");
        }
    }

    /// A proposed fix.
    ///
    /// @param replacement the text to put in place of `span`, or null when the fix cannot be
    ///                    applied mechanically
    public record Suggestion(String message, Span span, String replacement) {
        public Suggestion {
            Objects.requireNonNull(message, "message must not be null");
            Objects.requireNonNull(span, "span must not be null");
        }
    }
}
