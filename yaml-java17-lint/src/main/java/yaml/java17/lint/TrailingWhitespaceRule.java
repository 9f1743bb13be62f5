package yaml.java17.lint;

import java.util.ArrayList;
import java.util.List;

final class TrailingWhitespaceRule implements LintRule {

    static final String ID = "trailing-whitespace";

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
        for (int line = 1; line <= context.lineCount(); line++) {
            final String text = context.line(line);
            int end = text.length();
            while (end > 0 && (text.charAt(end - 1) == ' ' || text.charAt(end - 1) == '\t')) {
                end--;
            }
            if (end == text.length()) {
                continue;
            }
            final int start = context.lineStart(line);
            final var span = context.span(start + end, start + text.length());
            out.add(context.diagnostic(this, "trailing whitespace", span)
                    .withSuggestion("remove the trailing whitespace", span, ""));
        }
        return out;
    }
}
