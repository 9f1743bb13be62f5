package yaml.java17.lint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import yaml.java17.Location;
import yaml.java17.Span;

import java.io.UncheckedIOException;
import java.util.List;

/// Renders diagnostics as a pretty-printed JSON array for tools.
///
/// Each element has `rule`, `severity`, `message`, `span`, `labels` and `suggestions`; a span is
/// `{"start": {"line", "column", "offset"}, "end": {...}}` and a suggestion without a mechanical fix
/// has a null `replacement`.
final class JsonDiagnosticFormatter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonDiagnosticFormatter() {
    }

    static String format(List<Diagnostic> diagnostics) {
        final ArrayNode array = MAPPER.createArrayNode();
        for (Diagnostic diagnostic : diagnostics) {
            final ObjectNode node = array.addObject();
            node.put("rule", diagnostic.ruleId());
            node.put("severity", diagnostic.severity().label());
            node.put("message", diagnostic.message());
            node.set("span", span(diagnostic.span()));
            final ArrayNode labels = node.putArray("labels");
            for (Diagnostic.Label label : diagnostic.labels()) {
                final ObjectNode labelNode = labels.addObject();
                labelNode.put("message", label.message());
                labelNode.set("span", span(label.span()));
            }
            final ArrayNode suggestions = node.putArray("suggestions");
            for (Diagnostic.Suggestion suggestion : diagnostic.suggestions()) {
                final ObjectNode suggestionNode = suggestions.addObject();
                suggestionNode.put("message", suggestion.message());
                suggestionNode.set("span", span(suggestion.span()));
                suggestionNode.put("replacement", suggestion.replacement());
            }
        }
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(array);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static ObjectNode span(Span span) {
        final ObjectNode node = MAPPER.createObjectNode();
        node.set("start", location(span.start()));
        node.set("end", location(span.end()));
        return node;
    }

    private static ObjectNode location(Location location) {
        final ObjectNode node = MAPPER.createObjectNode();
        node.put("line", location.line());
        node.put("column", location.column());
        node.put("offset", location.offset());
        return node;
    }
}
