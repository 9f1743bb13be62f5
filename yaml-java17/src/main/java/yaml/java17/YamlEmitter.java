package yaml.java17;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Writes a value graph as YAML text that parses back to an equal graph.
///
/// Block style is the default: mappings as `key: value` lines, sequences as `- item` lines,
/// a mapping or sequence inside a sequence entry in the compact `- key: value` form. Empty
/// collections, collection keys and everything under `defaultFlowStyle` are written in flow
/// style. Each scalar gets the first style that is lossless:
///
/// 1. plain, when the text reads back as the same string;
/// 2. literal block (`|`, `|-`, `|+`) for multi-line strings in block context;
/// 3. single-quoted, for single-line strings without control characters;
/// 4. double-quoted with escapes otherwise.
public final class YamlEmitter {

    private static final Logger LOG = Logger.getLogger(YamlEmitter.class.getName());

    private final EmitterOptions options;

    public YamlEmitter(EmitterOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /// Emits one document. The text always ends with a line break.
    public String emit(YamlValue value) {
        Objects.requireNonNull(value, "value must not be null");
        final StringBuilder out = new StringBuilder();
        writeDocument(out, value, options.explicitStart());
        return out.toString();
    }

    /// Emits a stream; every document after the first starts with `---`.
    public String emitAll(List<? extends YamlValue> values) {
        Objects.requireNonNull(values, "values must not be null");
        final StringBuilder out = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            writeDocument(out, Objects.requireNonNull(values.get(i), "document must not be null"),
                    options.explicitStart() || i > 0);
        }
        LOG.fine(() -> "emitted " + values.size() + " document(s), chars=" + out.length());
        return out.toString();
    }

    private void writeDocument(StringBuilder out, YamlValue value, boolean marker) {
        final boolean block = isBlockCollection(value);
        if (marker) {
            out.append(block ? "---\n" : "--- ");
        }
        if (block) {
            writeBlock(out, value, 0, false, 1);
        } else if (value instanceof YamlString s && literalChomp(s.value()) != null) {
            writeLiteral(out, s.value(), options.indent());
        } else {
            out.append(flow(value, -1, 1, column(out)));
            out.append('\n');
        }
    }

    private boolean isBlockCollection(YamlValue value) {
        if (options.defaultFlowStyle()) {
            return false;
        }
        if (value instanceof YamlSequence s) {
            return !s.values().isEmpty();
        }
        if (value instanceof YamlMapping m) {
            return !m.entries().isEmpty();
        }
        return false;
    }

    // ---------------------------------------------------------------- block style

    /// Writes a non-empty block collection whose lines start at column `indent`. With `inline`
    /// the first line's indentation is already on the output (after `- `).
    private void writeBlock(StringBuilder out, YamlValue value, int indent, boolean inline, int depth) {
        checkDepth(depth);
        boolean first = true;
        if (value instanceof YamlSequence seq) {
            for (YamlValue element : seq.values()) {
                if (!(first && inline)) {
                    out.append(" ".repeat(indent));
                }
                first = false;
                out.append('-');
                writeEntryValue(out, element, indent, depth, true);
            }
            return;
        }
        for (YamlMapping.Entry entry : entriesOf((YamlMapping) value)) {
            if (!(first && inline)) {
                out.append(" ".repeat(indent));
            }
            first = false;
            final YamlValue key = entry.key();
            if (key instanceof YamlSequence || key instanceof YamlMapping) {
                out.append("? ").append(flow(key, indent, depth + 1, column(out) + 2)).append('\n');
                out.append(" ".repeat(indent)).append(':');
            } else {
                out.append(scalar(key, false)).append(':');
            }
            writeEntryValue(out, entry.value(), indent, depth, false);
        }
    }

    /// Writes what follows `-` or `key:`, including the line break.
    private void writeEntryValue(StringBuilder out, YamlValue value, int indent, int depth, boolean inSequence) {
        if (isBlockCollection(value)) {
            if (inSequence) {
                out.append(' ');
                writeBlock(out, value, indent + 2, true, depth + 1);
            } else {
                out.append('\n');
                writeBlock(out, value, indent + options.indent(), false, depth + 1);
            }
            return;
        }
        out.append(' ');
        if (value instanceof YamlString s && literalChomp(s.value()) != null) {
            writeLiteral(out, s.value(), indent + options.indent());
            return;
        }
        out.append(flow(value, indent, depth + 1, column(out)));
        out.append('\n');
    }

    private void writeLiteral(StringBuilder out, String text, int contentIndent) {
        out.append('|').append(literalChomp(text)).append('\n');
        final String body = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
        final String pad = " ".repeat(contentIndent);
        for (String line : body.split("\n", -1)) {
            if (!line.isEmpty()) {
                out.append(pad).append(line);
            }
            out.append('\n');
        }
    }

    /// {@return the chomping indicator for a lossless literal block, or null if the text
    /// cannot be written as one}
    private String literalChomp(String text) {
        if (text.indexOf('\n') < 0) {
            return null;
        }
        final String[] lines = text.split("\n", -1);
        boolean content = false;
        for (String line : lines) {
            if (line.isEmpty()) {
                continue;
            }
            if (!content && YamlLexical.isWhite(line.charAt(0))) {
                return null;
            }
            content = true;
            if (YamlLexical.isWhite(line.charAt(line.length() - 1))) {
                return null;
            }
            for (int i = 0; i < line.length(); i++) {
                final char c = line.charAt(i);
                if ((c != '\t' && needsEscape(c)) || (!options.allowUnicode() && c > 0x7E)) {
                    return null;
                }
            }
        }
        if (!content) {
            return null;
        }
        if (!text.endsWith("\n")) {
            return "-";
        }
        return text.endsWith("\n\n") ? "+" : "";
    }

    private List<YamlMapping.Entry> entriesOf(YamlMapping mapping) {
        if (!options.sortKeys()) {
            return mapping.entries();
        }
        final List<YamlMapping.Entry> sorted = new ArrayList<>(mapping.entries());
        sorted.sort((a, b) -> YamlValues.ORDER.compare(a.key(), b.key()));
        return sorted;
    }

    private static int column(StringBuilder out) {
        return out.length() - (out.lastIndexOf("\n") + 1);
    }

    private static void checkDepth(int depth) {
        if (depth > YamlScanner.MAX_DEPTH) {
            throw new YamlEmitException("value nesting exceeds the maximum depth of " + YamlScanner.MAX_DEPTH);
        }
    }

    // ---------------------------------------------------------------- flow style

    /// Renders a value in flow style. Continuation lines of a wrapped collection are indented
    /// one step past `blockIndent`.
    private String flow(YamlValue value, int blockIndent, int depth, int startColumn) {
        final StringBuilder out = new StringBuilder();
        final int wrapIndent = Math.max(blockIndent, 0) + options.indent();
        writeFlow(out, value, wrapIndent, depth, startColumn);
        return out.toString();
    }

    private void writeFlow(StringBuilder out, YamlValue value, int wrapIndent, int depth, int startColumn) {
        if (value instanceof YamlSequence seq) {
            checkDepth(depth);
            out.append('[');
            boolean first = true;
            for (YamlValue element : seq.values()) {
                separator(out, first, wrapIndent, startColumn);
                first = false;
                writeFlow(out, element, wrapIndent, depth + 1, startColumn);
            }
            out.append(']');
        } else if (value instanceof YamlMapping map) {
            checkDepth(depth);
            out.append('{');
            boolean first = true;
            for (YamlMapping.Entry entry : entriesOf(map)) {
                separator(out, first, wrapIndent, startColumn);
                first = false;
                final YamlValue key = entry.key();
                if (key instanceof YamlSequence || key instanceof YamlMapping) {
                    out.append("? ");
                }
                writeFlow(out, key, wrapIndent, depth + 1, startColumn);
                out.append(": ");
                writeFlow(out, entry.value(), wrapIndent, depth + 1, startColumn);
            }
            out.append('}');
        } else {
            out.append(scalar(value, true));
        }
    }

    private void separator(StringBuilder out, boolean first, int wrapIndent, int startColumn) {
        if (first) {
            return;
        }
        final int lastBreak = out.lastIndexOf("\n");
        final int lineColumn = lastBreak < 0 ? startColumn + out.length() : out.length() - lastBreak - 1;
        if (lineColumn >= options.width()) {
            out.append(",\n").append(" ".repeat(wrapIndent));
        } else {
            out.append(", ");
        }
    }

    // ---------------------------------------------------------------- scalars

    private String scalar(YamlValue value, boolean inFlow) {
        if (value instanceof YamlNull) {
            return "null";
        }
        if (value instanceof YamlBool b) {
            return b.value() ? "true" : "false";
        }
        if (value instanceof YamlInt i) {
            return i.value().toString();
        }
        if (value instanceof YamlFloat f) {
            return f.toString();
        }
        final String text = ((YamlString) value).value();
        if (isPlainSafe(text, inFlow)) {
            return text;
        }
        if (isSingleQuotable(text)) {
            return "'" + text.replace("'", "''") + "'";
        }
        return doubleQuoted(text);
    }

    private boolean isPlainSafe(String text, boolean inFlow) {
        if (text.isEmpty()) {
            return false;
        }
        final char first = text.charAt(0);
        final char last = text.charAt(text.length() - 1);
        if (first == ' ' || last == ' ' || last == ':' || isIndicator(first) || text.startsWith("...")) {
            return false;
        }
        if (text.contains(": ") || text.contains(" #")) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c < 0x20 || c == 0x7F || c > 0x7E && (!options.allowUnicode() || needsEscape(c))) {
                return false;
            }
            if (inFlow && YamlLexical.isFlowIndicator(c)) {
                return false;
            }
        }
        return !CoreSchema.resolvesToNonString(text) && !CoreSchema.isYaml11Boolean(text);
    }

    private static boolean isIndicator(char c) {
        return "-?:,[]{}#&*!|>'\"%@`".indexOf(c) >= 0;
    }

    private boolean isSingleQuotable(String text) {
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (needsEscape(c) || c == '\t' || (!options.allowUnicode() && c > 0x7E)) {
                return false;
            }
        }
        return true;
    }

    /// {@return true for characters that only a double-quoted escape can carry}
    private static boolean needsEscape(char c) {
        return c < 0x20 || c == 0x7F || (c >= 0x80 && c <= 0x9F)
                || c == '\u2028' || c == '\u2029' || c == '\uFEFF' || Character.isSurrogate(c);
    }

    private String doubleQuoted(String text) {
        final StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
        int i = 0;
        while (i < text.length()) {
            final int cp = text.codePointAt(i);
            i += Character.charCount(cp);
            switch (cp) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                case 0x00 -> sb.append("\\0");
                case 0x07 -> sb.append("\\a");
                case '\b' -> sb.append("\\b");
                case 0x0B -> sb.append("\\v");
                case '\f' -> sb.append("\\f");
                case 0x1B -> sb.append("\\e");
                case 0x85 -> sb.append("\\N");
                case 0x2028 -> sb.append("\\L");
                case 0x2029 -> sb.append("\\P");
                default -> appendCodePoint(sb, cp);
            }
        }
        return sb.append('"').toString();
    }

    private void appendCodePoint(StringBuilder sb, int cp) {
        if (cp < 0x20 || cp == 0x7F || (cp >= 0x80 && cp <= 0x9F)) {
            sb.append(String.format("\\x%02X", cp));
        } else if (cp == 0xFEFF || (cp >= Character.MIN_SURROGATE && cp <= Character.MAX_SURROGATE)) {
            sb.append(String.format("\\u%04X", cp));
        } else if (cp > 0x7E && !options.allowUnicode()) {
            sb.append(cp > 0xFFFF ? String.format("\\U%08X", cp) : String.format("\\u%04X", cp));
        } else {
            sb.appendCodePoint(cp);
        }
    }
}
