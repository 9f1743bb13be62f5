package yaml.java17.lint;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import yaml.java17.Location;
import yaml.java17.Span;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DiagnosticFormatTest extends LintTestBase {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static String text(String source) {
        return YamlLint.formatDiagnostics(lint(source), source, DiagnosticFormat.TEXT, false);
    }

    // ========== TEXT ==========

    @Test
    void testTextLayout() {
        assertThat(text("a: 1 \n")).isEqualTo(String.join("\n",
                "warning[trailing-whitespace]: trailing whitespace",
                " --> 1:5",
                "  |",
                "1 | a: 1 ",
                "  |     ^",
                "  = help: remove the trailing whitespace: delete",
                ""));
    }

    @Test
    void testTextShowsLabelsAndHelpWithoutReplacement() {
        final String out = text("a: 1\nb: 2\na: 3\n");
        LOG.fine(() -> out);
        assertThat(out).contains(
                "error[duplicate-key]: duplicate key 'a' (first defined at line 1)",
                " --> 3:1",
                "3 | a: 3\n  | ^\n",
                "1 | a: 1\n  | - first defined here\n",
                "  = help: remove this duplicate key or rename it\n");
    }

    @Test
    void testTextDescribesInsertions() {
        assertThat(text("a: 1")).contains("  = help: add a line break: insert \"\\n\"");
        assertThat(text("a:\nb: 1\n")).contains("  = help: add an explicit null: insert \" null\"");
        assertThat(text("m: 0755\n")).contains("replace with \"0o755\"");
    }

    @Test
    void testUnderlineKeepsTabsBeforeTheSpan() {
        assertThat(text("a:\n\tb: 1 \n")).contains("2 | \tb: 1 \n  | \t    ^\n");
    }

    @Test
    void testSpanAcrossLinesShowsEveryLine() {
        final String source = "k: |\n  one\n  two\nx: 1\n";
        final var block = new Span(new Location(1, 4, 3), new Location(3, 6, 16));
        final var diagnostic = new Diagnostic("custom", Severity.WARNING, "block scalar", block)
                .withLabel(new Span(new Location(2, 1, 5), new Location(4, 1, 17)), "body");
        final String out = YamlLint.formatDiagnostics(List.of(diagnostic), source, DiagnosticFormat.TEXT, false);
        LOG.fine(() -> out);
        assertThat(out).contains(
                "1 | k: |\n  |    ^\n2 |   one\n  | ^^^^^\n3 |   two\n  | ^^^^^\n",
                "2 |   one\n  | -----\n3 |   two\n  | ----- body\n");
        assertThat(out).doesNotContain("4 |");
    }

    @Test
    void testUnderlineCoversTheSpan() {
        final String source = "k: 0755\n";
        assertThat(text(source)).contains("1 | k: 0755\n  |    ^^^^\n");
    }

    @Test
    void testDiagnosticsAreSeparatedByABlankLine() {
        final String out = text("a: 1 \nb: 0755");
        assertThat(out).contains("delete\n\nwarning[octal-values]");
    }

    @Test
    void testGutterWidensForLargeLineNumbers() {
        final StringBuilder source = new StringBuilder();
        for (int i = 0; i < 11; i++) {
            source.append("k").append(i).append(": 1\n");
        }
        source.append("y: 2 \n");
        final String out = text(source.toString());
        assertThat(out).contains("  --> 12:5", "12 | y: 2 ", "   |     ^");
    }

    @Test
    void testColors() {
        final var diagnostics = lint("a: 1 \n");
        final String plain = YamlLint.formatDiagnostics(diagnostics, "a: 1 \n", DiagnosticFormat.TEXT, false);
        final String colored = YamlLint.formatDiagnostics(diagnostics, "a: 1 \n", DiagnosticFormat.TEXT, true);
        assertThat(plain).doesNotContain("\u001B[");
        assertThat(colored).contains("\u001B[33m", "\u001B[0m");
        assertThat(colored.replaceAll("\u001B\\[[0-9;]*m", "")).isEqualTo(plain);
    }

    @Test
    void testEmptyListRendersNothing() {
        assertThat(YamlLint.formatDiagnostics(List.of(), "a: 1\n", DiagnosticFormat.TEXT, true)).isEmpty();
    }

    // ========== JSON ==========

    @Test
    void testJsonIsReadableByJackson() throws Exception {
        final String source = "a: 1\nb: 2\na: 3 \n";
        final String json = YamlLint.formatDiagnostics(lint(source), source, DiagnosticFormat.JSON, true);
        final JsonNode array = MAPPER.readTree(json);
        assertThat(array.isArray()).isTrue();
        assertThat(array).hasSize(2);

        final JsonNode duplicate = array.get(0);
        assertThat(duplicate.get("rule").asText()).isEqualTo("duplicate-key");
        assertThat(duplicate.get("severity").asText()).isEqualTo("error");
        assertThat(duplicate.get("span").get("start").get("line").asInt()).isEqualTo(3);
        assertThat(duplicate.get("span").get("start").get("column").asInt()).isEqualTo(1);
        assertThat(duplicate.get("span").get("start").get("offset").asInt()).isEqualTo(10);
        assertThat(duplicate.get("labels").get(0).get("message").asText()).isEqualTo("first defined here");
        assertThat(duplicate.get("suggestions").get(0).get("replacement").isNull()).isTrue();

        final JsonNode trailing = array.get(1);
        assertThat(trailing.get("rule").asText()).isEqualTo("trailing-whitespace");
        assertThat(trailing.get("severity").asText()).isEqualTo("warning");
        assertThat(trailing.get("suggestions").get(0).get("replacement").asText()).isEmpty();
        assertThat(json).doesNotContain("\u001B[");
    }

    @Test
    void testJsonEmptyArray() throws Exception {
        final JsonNode array = MAPPER.readTree(YamlLint.formatDiagnostics(List.of(), "", DiagnosticFormat.JSON, false));
        assertThat(array.isArray()).isTrue();
        assertThat(array).isEmpty();
    }
}
