package yaml.java17.lint;

import yaml.java17.YamlEvent;

import java.util.ArrayList;
import java.util.List;

/// Mapping values left out entirely (`key:`), which resolve to null.
final class EmptyValuesRule implements LintRule {

    static final String ID = "empty-values";

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
        final List<Diagnostic> out = new ArrayList<>();
        for (LintContext.Node node : context.nodes()) {
            if (node.role() != LintContext.Role.VALUE || node.anchor() != null
                    || !(node.event() instanceof YamlEvent.Scalar scalar)
                    || !scalar.isEmptyNode() || scalar.tag() != null
                    || !(node.key().event() instanceof YamlEvent.Scalar key)) {
                continue;
            }
            final int keyEnd = key.span().end().offset();
            final var keySpan = key.span().isEmpty() ? context.span(keyEnd, keyEnd) : key.span();
            final Diagnostic diagnostic = context.diagnostic(this, "empty value for key '" + key.value() + "'", keySpan);
            final int colon = colonAfter(context.source(), keyEnd);
            out.add(colon < 0
                    ? diagnostic.withSuggestion("add an explicit null", context.span(keyEnd, keyEnd), ": null")
                    : diagnostic.withSuggestion("add an explicit null", context.span(colon + 1, colon + 1), " null"));
        }
        return out;
    }

    private static int colonAfter(String source, int from) {
        int i = from;
        while (i < source.length() && (source.charAt(i) == ' ' || source.charAt(i) == '\t')) {
            i++;
        }
        return i < source.length() && source.charAt(i) == ':' ? i : -1;
    }
}
