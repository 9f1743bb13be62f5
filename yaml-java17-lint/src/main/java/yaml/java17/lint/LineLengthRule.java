package yaml.java17.lint;

import java.util.ArrayList;
import java.util.List;

/// Lines longer than {@link LintConfig#maxLineLength()} code points.
final class LineLengthRule implements LintRule {

    static final String ID = "line-length";

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
        final int max = context.config().maxLineLength();
        final List<Diagnostic> out = new ArrayList<>();
        for (int line = 1; line <= context.lineCount(); line++) {
            final String text = context.line(line);
            final int length = text.codePointCount(0, text.length());
            if (length <= max) {
                continue;
            }
            final int start = context.lineStart(line);
            final int cut = text.offsetByCodePoints(0, max);
            out.add(context.diagnostic(this, "line too long (" + length + " > " + max + " characters)",
                    context.span(start + cut, start + text.length())));
        }
        return out;
    }
}
