package yaml.java17;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class YamlParserTest extends YamlTestBase {

    // ========== Block collections ==========

    @Test
    void testSimpleMapping() {
        final var value = Yaml.parse("key: value\n");
        assertThat(value).isEqualTo(YamlMapping.of(Map.of("key", YamlString.of("value"))));
    }

    @Test
    void testNestedMappingAndSequence() {
        final var value = Yaml.parse("""
                server:
                  host: localhost
                  ports:
                    - 8080
                    - 8443
                """);
        assertThat(value.get("server").get("host").string()).isEqualTo("localhost");
        assertThat(value.get("server").get("ports").elements())
                .containsExactly(YamlInt.of(8080), YamlInt.of(8443));
    }

    @Test
    void testIndentlessSequenceUnderKey() {
        final var value = Yaml.parse("""
                key:
                - a
                - b
                other: 1
                """);
        assertThat(value.get("key")).isEqualTo(YamlSequence.of(YamlString.of("a"), YamlString.of("b")));
        assertThat(value.get("other").toLong()).isEqualTo(1L);
    }

    @Test
    void testCompactSequenceOfMappings() {
        final var value = Yaml.parse("""
                - a: 1
                  b: 2
                - c: 3
                """);
        assertThat(value.elements()).hasSize(2);
        assertThat(value.element(0).get("b").toLong()).isEqualTo(2L);
        assertThat(value.element(1).get("c").toLong()).isEqualTo(3L);
    }

    @Test
    void testCompactNestedSequences() {
        final var value = Yaml.parse("- - a\n  - b\n- c\n");
        assertThat(value).isEqualTo(YamlSequence.of(
                YamlSequence.of(YamlString.of("a"), YamlString.of("b")),
                YamlString.of("c")));
    }

    @Test
    void testEmptyValuesAreNull() {
        final var value = Yaml.parse("a:\nb: 2\nc:\n");
        assertThat(value.get("a").isNull()).isTrue();
        assertThat(value.get("b").toLong()).isEqualTo(2L);
        assertThat(value.get("c").isNull()).isTrue();
    }

    @Test
    void testEntryOrderIsPreserved() {
        final var value = (YamlMapping) Yaml.parse("z: 1\na: 2\nm: 3\n");
        assertThat(value.entries()).extracting(e -> e.key().string()).containsExactly("z", "a", "m");
    }

    @Test
    void testExplicitKeys() {
        final var value = Yaml.parse("? a\n: 1\n? [x, y]\n: 2\n");
        assertThat(value.get("a").toLong()).isEqualTo(1L);
        assertThat(value.get(YamlSequence.of(YamlString.of("x"), YamlString.of("y"))).toLong()).isEqualTo(2L);
    }

    @Test
    void testCommentsAreIgnored() {
        final var value = Yaml.parse("""
                # heading
                a: 1 # trailing
                # between
                b: x#y
                """);
        assertThat(value.get("a").toLong()).isEqualTo(1L);
        assertThat(value.get("b").string()).isEqualTo("x#y");
    }

    @Test
    void testCrLfLineBreaks() {
        final var value = Yaml.parse("a: 1\r\nb:\r\n  - x\r\n");
        assertThat(value.get("a").toLong()).isEqualTo(1L);
        assertThat(value.get("b").elements()).containsExactly(YamlString.of("x"));
    }

    @Test
    void testByteOrderMarkIsSkipped() {
        final var value = Yaml.parse("\uFEFFa: 1\n".getBytes(StandardCharsets.UTF_8));
        assertThat(value.get("a").toLong()).isEqualTo(1L);
    }

    // ========== Flow collections ==========

    @Test
    void testFlowCollections() {
        final var value = Yaml.parse("[1, {a: b}, 'x', [], {}]");
        assertThat(value).isEqualTo(YamlSequence.of(
                YamlInt.of(1),
                YamlMapping.of(Map.of("a", YamlString.of("b"))),
                YamlString.of("x"),
                YamlSequence.of(),
                YamlMapping.of()));
    }

    @Test
    void testMultiLineFlowCollection() {
        final var value = Yaml.parse("""
                key: [one,
                  two,
                  three,
                ]
                """);
        assertThat(value.get("key").elements()).hasSize(3);
    }

    @Test
    void testSinglePairMappingInFlowSequence() {
        final var value = Yaml.parse("[a: 1, b, \"c\":d]");
        assertThat(value.elements()).containsExactly(
                YamlMapping.of(Map.of("a", YamlInt.of(1))),
                YamlString.of("b"),
                YamlMapping.of(Map.of("c", YamlString.of("d"))));
    }

    @Test
    void testFlowMappingEmptyValues() {
        final var value = Yaml.parse("{a, b: , c: 3}");
        assertThat(value.get("a").isNull()).isTrue();
        assertThat(value.get("b").isNull()).isTrue();
        assertThat(value.get("c").toLong()).isEqualTo(3L);
    }

    // ========== Scalars ==========

    @Test
    void testMultiLinePlainScalarFolds() {
        final var value = Yaml.parse("a: this is\n  folded\n\n  text\n");
        assertThat(value.get("a").string()).isEqualTo("this is folded\ntext");
    }

    @Test
    void testDoubleQuotedEscapes() {
        final var value = Yaml.parse("a: \"line\\n\\ttab \\u00e9 \\x41 \\U0001F600\"\n");
        assertThat(value.get("a").string()).isEqualTo("line\n\ttab \u00e9 A \uD83D\uDE00");
    }

    @Test
    void testDoubleQuotedFoldingAndEscapedBreak() {
        assertThat(Yaml.parse("\"a\n  b\n\n  c\"").string()).isEqualTo("a b\nc");
        assertThat(Yaml.parse("\"abc\\\n   def\"").string()).isEqualTo("abcdef");
    }

    @Test
    void testSingleQuotedEscapedQuote() {
        assertThat(Yaml.parse("'it''s'").string()).isEqualTo("it's");
    }

    @Test
    void testQuotedScalarsAreAlwaysStrings() {
        final var value = Yaml.parse("a: '123'\nb: \"true\"\nc: 'null'\n");
        assertThat(value.get("a")).isEqualTo(YamlString.of("123"));
        assertThat(value.get("b")).isEqualTo(YamlString.of("true"));
        assertThat(value.get("c")).isEqualTo(YamlString.of("null"));
    }

    // ========== Anchors, tags, directives ==========

    @Test
    void testAnchorsAndAliasesShareValues() {
        final var value = Yaml.parse("""
                base: &b
                  x: 1
                derived: *b
                n: &n 5
                m: *n
                """);
        assertThat(value.get("derived")).isEqualTo(value.get("base"));
        assertThat(value.get("m").toLong()).isEqualTo(5L);
    }

    @Test
    void testAnchorsAreScopedToTheirDocument() {
        final List<YamlValue> docs = Yaml.parseAll("a: &x 1\n---\nb: &x 2\n").toList();
        assertThat(docs).hasSize(2);
        assertThat(docs.get(1).get("b").toLong()).isEqualTo(2L);
    }

    @Test
    void testCoreTagsForceKind() {
        final var value = Yaml.parse("""
                s: !!str 123
                f: !!float 1
                i: !!int "42"
                b: !!bool true
                n: !!null ~
                bang: ! 12
                other: !custom 7
                """);
        assertThat(value.get("s")).isEqualTo(YamlString.of("123"));
        assertThat(value.get("f")).isEqualTo(YamlFloat.of(1.0));
        assertThat(value.get("i")).isEqualTo(YamlInt.of(42));
        assertThat(value.get("b")).isEqualTo(YamlBool.of(true));
        assertThat(value.get("n").isNull()).isTrue();
        assertThat(value.get("bang")).isEqualTo(YamlString.of("12"));
        assertThat(value.get("other")).isEqualTo(YamlInt.of(7));
    }

    @Test
    void testTagDirectiveHandles() {
        final var value = Yaml.parse("%TAG !y! tag:yaml.org,2002:\n--- !y!str 42\n");
        assertThat(value).isEqualTo(YamlString.of("42"));
        final var verbatim = Yaml.parse("!<tag:yaml.org,2002:int> \"7\"");
        assertThat(verbatim).isEqualTo(YamlInt.of(7));
    }

    @Test
    void testYamlDirective() {
        assertThat(Yaml.parse("%YAML 1.2\n---\na: 1\n").get("a").toLong()).isEqualTo(1L);
    }

    // ========== Documents ==========

    @Test
    void testEmptyInputsParseToNull() {
        assertThat(Yaml.parse("")).isEqualTo(YamlNull.of());
        assertThat(Yaml.parse("   \n\n")).isEqualTo(YamlNull.of());
        assertThat(Yaml.parse("# only a comment\n")).isEqualTo(YamlNull.of());
        assertThat(Yaml.parse("---\n")).isEqualTo(YamlNull.of());
    }

    @Test
    void testParseAllYieldsEveryDocument() {
        final var docs = Yaml.parseAll("---\na: 1\n---\nb: 2\n...\n--- text\n").toList();
        assertThat(docs).containsExactly(
                YamlMapping.of(Map.of("a", YamlInt.of(1))),
                YamlMapping.of(Map.of("b", YamlInt.of(2))),
                YamlString.of("text"));
    }

    @Test
    void testParseAllOfEmptySourceIsEmpty() {
        assertThat(Yaml.parseAll("")).isEmpty();
        assertThat(Yaml.parseAll("# nothing\n")).isEmpty();
    }

    @Test
    void testParseDocumentsReportsMarkersAndSpans() {
        final List<YamlDocument> docs = Yaml.parseDocuments("a: 1\n---\nb: 2\n...\n");
        assertThat(docs).hasSize(2);
        assertThat(docs.get(0).explicitStart()).isFalse();
        assertThat(docs.get(0).explicitEnd()).isFalse();
        assertThat(docs.get(1).explicitStart()).isTrue();
        assertThat(docs.get(1).explicitEnd()).isTrue();
        assertThat(docs.get(1).span().start().line()).isEqualTo(2);
    }

    @Test
    void testPlainScalarStopsAtDocumentMarker() {
        final var docs = Yaml.parseAll("first\n---\nsecond\n").toList();
        assertThat(docs).containsExactly(YamlString.of("first"), YamlString.of("second"));
    }

    @Test
    void testBigIntegers() {
        final var value = Yaml.parse("123456789012345678901234567890");
        assertThat(value.toBigInteger()).isEqualTo(new BigInteger("123456789012345678901234567890"));
    }
}
