package yaml.java17;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class YamlScannerTest extends YamlTestBase {

    private static List<YamlEvent> events(YamlScanner scanner) {
        final List<YamlEvent> events = new ArrayList<>();
        scanner.forEachRemaining(events::add);
        return events;
    }

    private static List<String> shapes(List<YamlEvent> events) {
        return events.stream().map(YamlScannerTest::shape).toList();
    }

    private static String shape(YamlEvent event) {
        if (event instanceof YamlEvent.Scalar s) {
            return "=" + s.value();
        }
        if (event instanceof YamlEvent.Alias a) {
            return "*" + a.name();
        }
        if (event instanceof YamlEvent.Anchor a) {
            return "&" + a.name();
        }
        return event.getClass().getSimpleName();
    }

    @Test
    void testEventSequenceOfSimpleMapping() {
        final var events = events(new YamlScanner("a: 1\nb: [x]\n"));
        assertThat(shapes(events)).containsExactly(
                "StreamStart", "DocumentStart", "MappingStart",
                "=a", "=1", "=b", "SequenceStart", "=x", "SequenceEnd",
                "MappingEnd", "DocumentEnd", "StreamEnd");
    }

    @Test
    void testScalarStylesAndSpans() {
        final var events = events(new YamlScanner("- plain\n- 'single'\n- \"double\"\n- |\n  lit\n- >\n  fold\n"));
        final List<YamlEvent.ScalarStyle> styles = events.stream()
                .filter(YamlEvent.Scalar.class::isInstance)
                .map(e -> ((YamlEvent.Scalar) e).style())
                .toList();
        assertThat(styles).containsExactly(YamlEvent.ScalarStyle.PLAIN, YamlEvent.ScalarStyle.SINGLE_QUOTED,
                YamlEvent.ScalarStyle.DOUBLE_QUOTED, YamlEvent.ScalarStyle.LITERAL, YamlEvent.ScalarStyle.FOLDED);
        final var single = (YamlEvent.Scalar) events.stream()
                .filter(e -> e instanceof YamlEvent.Scalar s && s.style() == YamlEvent.ScalarStyle.SINGLE_QUOTED)
                .findFirst().orElseThrow();
        assertThat(single.span().start()).isEqualTo(new Location(2, 3, 10));
        assertThat(single.span().end()).isEqualTo(new Location(2, 11, 18));
    }

    @Test
    void testEmptyValueIsZeroWidthPlainScalar() {
        final var empty = events(new YamlScanner("a:\n")).stream()
                .filter(e -> e instanceof YamlEvent.Scalar s && s.isEmptyNode())
                .findFirst().orElseThrow();
        assertThat(empty.span().isEmpty()).isTrue();
    }

    @Test
    void testTagsAreResolvedOnEvents() {
        final var scalar = (YamlEvent.Scalar) events(new YamlScanner("!!str 1")).stream()
                .filter(YamlEvent.Scalar.class::isInstance)
                .findFirst().orElseThrow();
        assertThat(scalar.tag()).isEqualTo(CoreSchema.STR);
    }

    @Test
    void testAnchorPrecedesItsNode() {
        assertThat(shapes(events(new YamlScanner("- &a x\n- *a\n")))).containsSubsequence("&a", "=x", "*a");
    }

    @Test
    void testDocumentsAreScannedLazily() {
        final var scanner = new YamlScanner("a: 1\n---\n[unclosed\n");
        final List<String> first = new ArrayList<>();
        while (scanner.hasNext()) {
            final var event = scanner.next();
            first.add(shape(event));
            if (event instanceof YamlEvent.DocumentEnd) {
                break;
            }
        }
        assertThat(first).endsWith("DocumentEnd");
        assertThat(first).contains("=a", "=1");
    }

    @Test
    void testSliceReportsWholeSourceLocations() {
        final String source = "x: 0\n---\nkey: value\n";
        final int start = source.indexOf("key");
        final var scanner = new YamlScanner(source, start, source.length(), new Location(3, 1, start),
                ErrorMode.FAIL_FAST);
        final var key = (YamlEvent.Scalar) events(scanner).stream()
                .filter(YamlEvent.Scalar.class::isInstance)
                .findFirst().orElseThrow();
        assertThat(key.value()).isEqualTo("key");
        assertThat(key.span().start()).isEqualTo(new Location(3, 1, start));
    }

    // ========== COLLECT mode ==========

    @Test
    void testCollectResumesAtNextTopLevelEntry() {
        final var scanner = new YamlScanner("a: 1\nb: {x\nc: 3\n", ErrorMode.COLLECT);
        final var composer = new YamlComposer(scanner, ErrorMode.COLLECT);
        final var document = composer.nextDocument().orElseThrow();
        assertThat(scanner.problems()).hasSize(1);
        assertThat(document.root().get("a").toLong()).isEqualTo(1L);
        assertThat(document.root().get("b")).isEqualTo(YamlMapping.of(Map.of("x", YamlNull.of())));
        assertThat(document.root().get("c").toLong()).isEqualTo(3L);
    }

    @Test
    void testCollectRecordsTabOnlyOnce() {
        final var scanner = new YamlScanner("a:\n\tb: 1\n", ErrorMode.COLLECT);
        events(scanner);
        assertThat(scanner.problems()).extracting(YamlSyntaxException::reason)
                .containsExactly(YamlSyntaxException.Reason.TAB_INDENTATION);
    }

    @Test
    void testCollectRecordsProblemsInSeveralDocuments() {
        final var scanner = new YamlScanner("a: 'x\n---\nb: [\n---\nc: 1\n", ErrorMode.COLLECT);
        final var composer = new YamlComposer(scanner, ErrorMode.COLLECT);
        final var documents = composer.composeAll();
        assertThat(documents).hasSize(3);
        assertThat(scanner.problems()).hasSizeGreaterThanOrEqualTo(2);
        assertThat(documents.get(2).root().get("c").toLong()).isEqualTo(1L);
    }

    @Test
    void testCollectKeepsFirstValueOfDuplicateKey() {
        final var composer = new YamlComposer(new YamlScanner("k: 1\nk: 2\n", ErrorMode.COLLECT), ErrorMode.COLLECT);
        final var document = composer.nextDocument().orElseThrow();
        assertThat(composer.problems()).hasSize(1);
        assertThat(document.root().get("k").toLong()).isEqualTo(1L);
    }

    @Test
    void testCollectFallsBackOnInvalidTaggedValue() {
        final var composer = new YamlComposer(new YamlScanner("a: !!int abc\n", ErrorMode.COLLECT), ErrorMode.COLLECT);
        final var document = composer.nextDocument().orElseThrow();
        assertThat(composer.problems()).extracting(YamlSemanticException::reason)
                .containsExactly(YamlSemanticException.Reason.INVALID_TAGGED_VALUE);
        assertThat(document.root().get("a").string()).isEqualTo("abc");
    }
}
