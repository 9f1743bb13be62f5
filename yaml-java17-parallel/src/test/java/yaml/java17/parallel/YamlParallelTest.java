package yaml.java17.parallel;

import org.junit.jupiter.api.Test;
import yaml.java17.Yaml;
import yaml.java17.YamlSemanticException;
import yaml.java17.YamlSyntaxException;
import yaml.java17.YamlValidationException;
import yaml.java17.YamlValue;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlParallelTest extends ParallelTestBase {

    private static final String STREAM = String.join("\n",
            "%YAML 1.2",
            "---",
            "name: first",
            "tags: [a, b]",
            "---",
            "base: &b {x: 1}",
            "copy: *b",
            "...",
            "# between documents",
            "--- |",
            "  literal ---",
            "  it's fine",
            "---",
            "- 0o17",
            "- .inf",
            "- ~",
            "");

    @Test
    void testMatchesSequentialParse() {
        final List<YamlValue> expected = Yaml.parseAll(STREAM).toList();
        assertThat(expected).hasSize(4);
        for (int threads : new int[]{1, 2, 4, 16}) {
            assertThat(YamlParallel.splitAndParse(STREAM, ParallelConfig.defaults().withThreadCount(threads)))
                    .as("threads=%d", threads)
                    .containsExactlyElementsOf(expected);
        }
    }

    @Test
    void testAnchorsAreScopedToTheirDocument() {
        final var values = YamlParallel.splitAndParse(STREAM, ParallelConfig.defaults().withThreadCount(2));
        assertThat(values.get(1).get("copy")).isEqualTo(values.get(1).get("base"));
        assertThat(values.get(2).string()).isEqualTo("literal ---\nit's fine\n");
    }

    @Test
    void testSingleAndEmptyInputs() {
        assertThat(YamlParallel.splitAndParse("a: 1\n")).containsExactly(Yaml.parse("a: 1\n"));
        assertThat(YamlParallel.splitAndParse("")).isEmpty();
        assertThat(YamlParallel.splitAndParse("# nothing\n")).isEmpty();
    }

    @Test
    void testByteInput() {
        final byte[] utf8 = "--- caf\u00E9\n--- b\n".getBytes(StandardCharsets.UTF_8);
        assertThat(YamlParallel.splitAndParse(utf8, ParallelConfig.defaults()))
                .extracting(YamlValue::string).containsExactly("caf\u00E9", "b");
    }

    @Test
    void testFailureNamesTheDocumentWithAbsoluteLocation() {
        final String source = "a: 1\n---\nb: [\n---\nc: 3\n";
        assertThatThrownBy(() -> YamlParallel.splitAndParse(source, ParallelConfig.defaults().withThreadCount(3)))
                .isInstanceOfSatisfying(YamlParallelException.class, e -> {
                    assertThat(e.documentIndex()).isEqualTo(1);
                    assertThat(e.getCause()).isInstanceOf(YamlSyntaxException.class);
                    final var cause = (YamlSyntaxException) e.getCause();
                    assertThat(cause.location().line()).isEqualTo(3);
                    assertThat(e.getMessage()).startsWith("document 1 failed: ");
                });
    }

    @Test
    void testFirstFailureInDocumentOrderWins() {
        final String source = "a: 1\n---\nb: *nope\n---\nc: [\n";
        assertThatThrownBy(() -> YamlParallel.splitAndParse(source, ParallelConfig.defaults().withThreadCount(3)))
                .isInstanceOfSatisfying(YamlParallelException.class, e -> {
                    assertThat(e.documentIndex()).isEqualTo(1);
                    assertThat(e.getCause()).isInstanceOf(YamlSemanticException.class);
                    assertThat(e.problem()).isEqualTo("document 1 failed: undefined alias '*nope'");
                });
    }

    @Test
    void testSingleDocumentFailureIsWrapped() {
        assertThatThrownBy(() -> YamlParallel.splitAndParse("a: [\n"))
                .isInstanceOfSatisfying(YamlParallelException.class,
                        e -> assertThat(e.documentIndex()).isZero());
    }

    // ========== Limits ==========

    @Test
    void testInputSizeIsCountedInUtf8Bytes() {
        final var config = ParallelConfig.defaults().withMaxInputSize(10);
        assertThat(YamlParallel.splitAndParse("a: 123456", config)).hasSize(1);
        assertThatThrownBy(() -> YamlParallel.splitAndParse("a: \u00E9\u00E9\u00E9\u00E9", config))
                .isInstanceOfSatisfying(YamlValidationException.class, e -> {
                    assertThat(e.limit()).isEqualTo("maxInputSize");
                    assertThat(e.configured()).isEqualTo(10);
                    assertThat(e.observed()).isEqualTo(11);
                });
    }

    @Test
    void testOversizedBytesAreRejectedBeforeDecoding() {
        final byte[] utf8 = new byte[]{'a', ':', ' ', (byte) 0xFF, (byte) 0xFF};
        assertThatThrownBy(() -> YamlParallel.splitAndParse(utf8, ParallelConfig.defaults().withMaxInputSize(4)))
                .isInstanceOf(YamlValidationException.class);
    }

    @Test
    void testOversizedInputFailsEvenWhenMalformed() {
        assertThatThrownBy(() -> YamlParallel.splitAndParse("a: [[[[[[", ParallelConfig.defaults().withMaxInputSize(5)))
                .isInstanceOf(YamlValidationException.class);
    }

    @Test
    void testDocumentCountLimit() {
        final var config = ParallelConfig.defaults().withMaxDocumentCount(2);
        assertThat(YamlParallel.splitAndParse("--- 1\n--- 2\n", config)).hasSize(2);
        assertThatThrownBy(() -> YamlParallel.splitAndParse("--- 1\n--- 2\n--- [\n", config))
                .isInstanceOfSatisfying(YamlValidationException.class, e -> {
                    assertThat(e.limit()).isEqualTo("maxDocumentCount");
                    assertThat(e.observed()).isEqualTo(3);
                });
    }

    @Test
    void testUtf8Length() {
        for (String s : List.of("", "ascii", "caf\u00E9", "\u20AC", "\uD83D\uDE00 smile", "lone \uD800 surrogate")) {
            assertThat(YamlParallel.utf8Length(s)).as(s).isEqualTo(s.getBytes(StandardCharsets.UTF_8).length);
        }
    }
}
