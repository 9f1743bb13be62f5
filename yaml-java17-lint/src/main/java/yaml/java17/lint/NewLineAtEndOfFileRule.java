package yaml.java17.lint;

import yaml.java17.Span;

import java.util.List;

final class NewLineAtEndOfFileRule implements LintRule {

    static final String ID = "new-line-at-end-of-file";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Severity defaultSeverity() {
        return Severity.WARNING;
    }

    @Override
    public List<Diagnostic> check(LintContext context) {
        final String source = context.source();
        if (source.isEmpty() || source.endsWith("\n") || source.endsWith("\r")) {
            return List.of();
        }
        final Span end = Span.at(context.location(source.length()));
        return List.of(context.diagnostic(this, "no new line character at the end of file", end)
                .withSuggestion("add a line break", end, "\n"));
    }
}
