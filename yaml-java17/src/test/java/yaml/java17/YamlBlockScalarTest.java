package yaml.java17;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlBlockScalarTest extends YamlTestBase {

    @Test
    void testLiteralClip() {
        final var value = Yaml.parse("text: |\n  line one\n  line two\n\nnext: 1\n");
        assertThat(value.get("text").string()).isEqualTo("line one\nline two\n");
        assertThat(value.get("next").toLong()).isEqualTo(1L);
    }

    @Test
    void testLiteralStrip() {
        assertThat(Yaml.parse("a: |-\n  x\n  y\n\n").get("a").string()).isEqualTo("x\ny");
    }

    @Test
    void testLiteralKeep() {
        assertThat(Yaml.parse("a: |+\n  x\n\n").get("a").string()).isEqualTo("x\n\n");
    }

    @Test
    void testLiteralKeepsInnerIndentation() {
        assertThat(Yaml.parse("|\n  a\n    b\n  c\n").string()).isEqualTo("a\n  b\nc\n");
    }

    @Test
    void testLiteralWithoutTrailingBreak() {
        assertThat(Yaml.parse("|\n  a").string()).isEqualTo("a");
    }

    @Test
    void testFoldedJoinsLines() {
        assertThat(Yaml.parse(">\n  one\n  two\n\n  three\n").string()).isEqualTo("one two\nthree\n");
    }

    @Test
    void testFoldedKeepsMoreIndentedLines() {
        assertThat(Yaml.parse(">\n a\n  b\n c\n").string()).isEqualTo("a\n b\nc\n");
    }

    @Test
    void testFoldedStrip() {
        assertThat(Yaml.parse("k: >-\n  one\n  two\n").get("k").string()).isEqualTo("one two");
    }

    @Test
    void testExplicitIndentationIndicator() {
        assertThat(Yaml.parse("|1\n  x\n").string()).isEqualTo(" x\n");
    }

    @Test
    void testCombinedHeaderAndComment() {
        assertThat(Yaml.parse("a: |-2 # note\n    x\n").get("a").string()).isEqualTo("  x");
        assertThat(Yaml.parse("a: >+ # note\n  x\n").get("a").string()).isEqualTo("x\n");
    }

    @Test
    void testEmptyBlockScalar() {
        final var value = Yaml.parse("a: |\nb: 1\n");
        assertThat(value.get("a").string()).isEmpty();
        assertThat(value.get("b").toLong()).isEqualTo(1L);
    }

    @Test
    void testBlockScalarInSequence() {
        final var value = Yaml.parse("- |\n  one\n- two\n");
        assertThat(value.elements()).containsExactly(YamlString.of("one\n"), YamlString.of("two"));
    }

    @Test
    void testBlockScalarIsAlwaysString() {
        assertThat(Yaml.parse("|\n  123\n")).isEqualTo(YamlString.of("123\n"));
    }

    @Test
    void testZeroIndentationIndicatorIsRejected() {
        assertThatThrownBy(() -> Yaml.parse("|0\n x\n"))
                .isInstanceOf(YamlSyntaxException.class)
                .extracting(e -> ((YamlSyntaxException) e).reason())
                .isEqualTo(YamlSyntaxException.Reason.INVALID_BLOCK_HEADER);
    }

    @Test
    void testGarbageAfterHeaderIsRejected() {
        assertThatThrownBy(() -> Yaml.parse("a: |x\n  y\n"))
                .isInstanceOf(YamlSyntaxException.class)
                .extracting(e -> ((YamlSyntaxException) e).reason())
                .isEqualTo(YamlSyntaxException.Reason.INVALID_BLOCK_HEADER);
    }
}
