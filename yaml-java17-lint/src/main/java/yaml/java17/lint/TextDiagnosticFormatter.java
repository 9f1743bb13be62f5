package yaml.java17.lint;

import yaml.java17.Location;
import yaml.java17.Span;

import java.util.List;

/// Renders diagnostics for a terminal:
///
/// ```
/// warning[trailing-whitespace]: trailing whitespace
///  --> 1:5
///   |
/// 1 | a: 1
///   |     ^^
///   = help: remove the trailing whitespace: delete
/// ```
///
/// Tabs before a span are kept in the underline padding so the carets line up in any terminal.
final class TextDiagnosticFormatter {

    private static final String RESET = "\u001B[0m";
    private static final String BOLD = "\u001B[1m";
    private static final String BLUE = "\u001B[34m";

    private final String source;
    private final boolean colors;

    TextDiagnosticFormatter(String source, boolean colors) {
        this.source = source;
        this.colors = colors;
    }

    String format(List<Diagnostic> diagnostics) {
        final StringBuilder out = new StringBuilder();
        for (Diagnostic diagnostic : diagnostics) {
            if (out.length() > 0) {
                out.append('\n');
            }
            render(diagnostic, out);
        }
        return out.toString();
    }

    private void render(Diagnostic diagnostic, StringBuilder out) {
        final String color = color(diagnostic.severity());
        int maxLine = lastLine(diagnostic.span());
        for (Diagnostic.Label label : diagnostic.labels()) {
            maxLine = Math.max(maxLine, lastLine(label.span()));
        }
        final String gutter = " ".repeat(String.valueOf(maxLine).length());

        out.append(paint(BOLD + color, diagnostic.severity().label() + "[" + diagnostic.ruleId() + "]"))
                .append(paint(BOLD, ": " + diagnostic.message())).append('\n');
        final Location start = diagnostic.span().start();
        out.append(gutter).append(paint(BLUE, "--> ")).append(start.line()).append(':').append(start.column()).append('\n');
        out.append(gutter).append(paint(BLUE, " |")).append('\n');
        snippet(diagnostic.span(), '^', null, color, gutter, out);
        for (Diagnostic.Label label : diagnostic.labels()) {
            snippet(label.span(), '-', label.message(), BLUE, gutter, out);
        }
        for (Diagnostic.Suggestion suggestion : diagnostic.suggestions()) {
            out.append(gutter).append(paint(BLUE, " = ")).append(paint(BOLD, "help")).append(": ")
                    .append(suggestion.message());
            if (suggestion.replacement() != null) {
                out.append(": ").append(describe(suggestion));
            }
            out.append('\n');
        }
    }

    /// Prints every line the span touches with its underline; a label message follows the last
    /// underline. A span that ends at the start of a line does not show that line.
    private void snippet(Span span, char mark, String message, String color, String gutter, StringBuilder out) {
        final Location start = span.start();
        final int last = lastLine(span);
        int lineStart = Math.max(0, Math.min(source.length(), start.offset() - (start.column() - 1)));
        for (int line = start.line(); line <= last; line++) {
            int lineEnd = lineStart;
            while (lineEnd < source.length() && source.charAt(lineEnd) != '\n' && source.charAt(lineEnd) != '\r') {
                lineEnd++;
            }
            final String text = source.substring(lineStart, lineEnd);
            final int from = line == start.line() ? Math.min(text.length(), start.offset() - lineStart) : 0;
            final int to = line == span.end().line()
                    ? Math.max(from, Math.min(text.length(), span.end().offset() - lineStart))
                    : text.length();

            final StringBuilder padding = new StringBuilder();
            text.substring(0, from).codePoints().forEach(cp -> padding.append(cp == '\t' ? '\t' : ' '));
            final int width = Math.max(1, text.codePointCount(from, to));

            final String number = String.valueOf(line);
            out.append(" ".repeat(Math.max(0, gutter.length() - number.length()))).append(paint(BLUE, number + " |"));
            if (!text.isEmpty()) {
                out.append(' ').append(text);
            }
            out.append('\n');
            final String note = message == null || line != last ? "" : " " + message;
            out.append(gutter).append(paint(BLUE, " |")).append(' ').append(padding)
                    .append(paint(color, String.valueOf(mark).repeat(width) + note))
                    .append('\n');

            if (lineEnd >= source.length()) {
                break;
            }
            lineStart = lineEnd + (source.startsWith("\r\n", lineEnd) ? 2 : 1);
        }
    }

    private static int lastLine(Span span) {
        if (!span.isSingleLine() && span.end().column() == 1) {
            return span.end().line() - 1;
        }
        return span.end().line();
    }

    private String paint(String code, String text) {
        return colors ? code + text + RESET : text;
    }

    private static String color(Severity severity) {
        return switch (severity) {
            case ERROR -> "\u001B[31m";
            case WARNING -> "\u001B[33m";
            case INFO -> BLUE;
            case HINT -> "\u001B[36m";
        };
    }

    private static String describe(Diagnostic.Suggestion suggestion) {
        if (suggestion.replacement().isEmpty()) {
            return "delete";
        }
        final String quoted = "\"" + escape(suggestion.replacement()) + "\"";
        return suggestion.span().isEmpty() ? "insert " + quoted : "replace with " + quoted;
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\t", "\\t");
    }
}
