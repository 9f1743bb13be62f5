package yaml.java17.lint;

import yaml.java17.YamlEvent;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/// Nested block collections must be indented by one consistent step.
///
/// The step is {@link LintConfig#indentSize()}, or the first step found in the source when that
/// is 0. Compact collections (`- a: 1`) and indentless sequences under a mapping key are skipped
/// because the indicator before them fixes their column.
final class IndentationRule implements LintRule {

    static final String ID = "indentation";

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
        final Map<YamlEvent, Integer> positions = new IdentityHashMap<>();
        final List<YamlEvent> events = context.events();
        for (int i = 0; i < events.size(); i++) {
            positions.put(events.get(i), i);
        }
        int step = context.config().indentSize();
        final List<Diagnostic> out = new ArrayList<>();
        for (LintContext.Node node : context.nodes()) {
            if (!node.isBlockCollection() || node.role() == LintContext.Role.ROOT) {
                continue;
            }
            final LintContext.Node parent = enclosingBlock(node);
            if (parent == null) {
                continue;
            }
            final int offset = lineStartingOffset(context, positions, node);
            if (offset < 0) {
                continue;
            }
            final int column = context.location(offset).column();
            final int parentColumn = column(context, positions, parent);
            final int found = column - parentColumn;
            if (found == 0 && node.event() instanceof YamlEvent.SequenceStart
                    && parent.event() instanceof YamlEvent.MappingStart) {
                continue;
            }
            if (step == 0) {
                if (found > 0) {
                    step = found;
                }
                continue;
            }
            if (found == step) {
                continue;
            }
            final int expectedIndent = parentColumn - 1 + step;
            final int lineStart = offset - (column - 1);
            final var span = context.span(lineStart, offset);
            out.add(context.diagnostic(this,
                            "wrong indentation: expected " + expectedIndent + " but found " + (column - 1), span)
                    .withSuggestion("indent by " + expectedIndent + " spaces", span, " ".repeat(expectedIndent)));
        }
        return out;
    }

    private static LintContext.Node enclosingBlock(LintContext.Node node) {
        LintContext.Node parent = node.parent();
        while (parent != null && !parent.isBlockCollection()) {
            parent = parent.parent();
        }
        return parent;
    }

    /// {@return the offset the collection's content starts at, or -1 for a compact collection}
    private static int lineStartingOffset(LintContext context, Map<YamlEvent, Integer> positions,
                                          LintContext.Node node) {
        final int start = node.span().start().offset();
        if (context.startsLine(start)) {
            return start;
        }
        final YamlEvent next = nextContent(context, positions, node.event());
        if (next != null && context.startsLine(next.span().start().offset())) {
            return next.span().start().offset();
        }
        return -1;
    }

    private static int column(LintContext context, Map<YamlEvent, Integer> positions, LintContext.Node node) {
        final int offset = lineStartingOffset(context, positions, node);
        return context.location(offset < 0 ? node.span().start().offset() : offset).column();
    }

    // The start of a collection with properties sits at the properties, which may be on the line
    // before the first entry.
    private static YamlEvent nextContent(LintContext context, Map<YamlEvent, Integer> positions, YamlEvent event) {
        final List<YamlEvent> events = context.events();
        for (int i = positions.get(event) + 1; i < events.size(); i++) {
            if (!(events.get(i) instanceof YamlEvent.Anchor)) {
                return events.get(i);
            }
        }
        return null;
    }
}
