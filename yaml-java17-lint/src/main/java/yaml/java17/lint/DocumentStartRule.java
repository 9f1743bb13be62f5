package yaml.java17.lint;

import yaml.java17.YamlEvent;

import java.util.ArrayList;
import java.util.List;

/// Documents without an explicit `---`. Off unless enabled.
final class DocumentStartRule implements LintRule {

    static final String ID = "document-start";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Severity defaultSeverity() {
        return Severity.WARNING;
    }

    @Override
    public boolean enabledByDefault() {
        return false;
    }

    @Override
    public List<Diagnostic> check(LintContext context) {
        final List<Diagnostic> out = new ArrayList<>();
        for (YamlEvent event : context.events()) {
            if (!(event instanceof YamlEvent.DocumentStart start) || start.explicit()) {
                continue;
            }
            final int line = start.span().start().line();
            final var at = context.span(context.lineStart(line), context.lineStart(line));
            out.add(context.diagnostic(this, "missing document start \"---\"", at)
                    .withSuggestion("start the document with ---", at, "---\n"));
        }
        return out;
    }
}
