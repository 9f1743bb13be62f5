package yaml.java17;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

/// `parse(serialize(v, options))` equals `v` for generated value graphs and option sets.
class YamlRoundTripPropertyTest extends YamlLoggingConfig {

    private static final Logger LOG = Logger.getLogger(YamlRoundTripPropertyTest.class.getName());

    private static final int MAX_DEPTH = 3;

    private static final List<String> TRICKY_STRINGS = List.of(
            "", " ", "true", "false", "null", "~", "yes", "No", "on", "123", "-1", "0x1F", "0o7", "1e3",
            ".nan", "-.inf", "- x", "? y", ": z", "a: b", "a #b", "#c", "&a", "*a", "!t", "|", ">",
            "'q'", "\"dq\"", "%p", "@x", "`x", "---", "...", "[x]", "{y}", "a,b", "trailing:",
            "line1\nline2", "line\n", "two\n\n", "\nlead", "  indented\nx", "tab\tin", "\u00e9t\u00e9",
            "\uD83D\uDE00", "\u0085", "\u2028", "\u00A0", "\uFEFF", "ends with space ", "back\\slash");

    @Provide
    Arbitrary<EmitterOptions> options() {
        return Combinators.combine(
                Arbitraries.of(true, false),
                Arbitraries.of(true, false),
                Arbitraries.of(true, false),
                Arbitraries.integers().between(1, 9),
                Arbitraries.of(10, 40, 80),
                Arbitraries.of(true, false)
        ).as(EmitterOptions::new);
    }

    @Provide
    Arbitrary<YamlValue> values() {
        return arbitraryValue(MAX_DEPTH);
    }

    private static Arbitrary<YamlValue> arbitraryValue(int depth) {
        if (depth == 0) {
            return arbitraryScalar();
        }
        return Arbitraries.oneOf(
                arbitraryScalar(),
                arbitrarySequence(depth),
                arbitraryMapping(depth));
    }

    private static Arbitrary<YamlValue> arbitraryScalar() {
        return Arbitraries.oneOf(
                Arbitraries.just(YamlNull.of()),
                Arbitraries.of(true, false).map(YamlBool::of),
                Arbitraries.longs().map(YamlInt::of),
                Arbitraries.bigIntegers().between(BigInteger.TEN.pow(20), BigInteger.TEN.pow(30)).map(YamlInt::of),
                Arbitraries.doubles().map(YamlFloat::of),
                Arbitraries.of(Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY, -0.0, 1e300)
                        .map(YamlFloat::of),
                arbitraryString().map(YamlString::of));
    }

    private static Arbitrary<String> arbitraryString() {
        return Arbitraries.oneOf(
                Arbitraries.of(TRICKY_STRINGS),
                Arbitraries.strings().withChars("ab :#-\n\t'\"\\,[]{}").ofMaxLength(12),
                Arbitraries.strings().alpha().ofMinLength(1).ofMaxLength(10));
    }

    private static Arbitrary<YamlValue> arbitrarySequence(int depth) {
        return arbitraryValue(depth - 1).list().ofMaxSize(4)
                .map(values -> (YamlValue) YamlSequence.of(values));
    }

    private static Arbitrary<YamlValue> arbitraryMapping(int depth) {
        final Arbitrary<YamlValue> keys = Arbitraries.oneOf(
                arbitraryScalar(),
                arbitraryScalar().list().ofMaxSize(2).map(values -> (YamlValue) YamlSequence.of(values)));
        final Arbitrary<YamlMapping.Entry> entries = Combinators.combine(keys, arbitraryValue(depth - 1))
                .as(YamlMapping.Entry::new);
        return entries.list().ofMaxSize(4).map(list -> {
            final Map<YamlValue, YamlMapping.Entry> unique = new LinkedHashMap<>();
            for (YamlMapping.Entry entry : list) {
                unique.putIfAbsent(entry.key(), entry);
            }
            return (YamlValue) YamlMapping.of(new ArrayList<>(unique.values()));
        });
    }

    @Property(tries = 300)
    void serializeThenParseIsIdentity(@ForAll("values") YamlValue value, @ForAll("options") EmitterOptions options) {
        final String text = Yaml.serialize(value, options);
        LOG.finest(() -> "round trip " + options + "\n" + text);
        assertThat(Yaml.parse(text)).isEqualTo(value);
    }

    @Property(tries = 100)
    void serializeAllThenParseAllIsIdentity(@ForAll("values") YamlValue first, @ForAll("values") YamlValue second,
                                            @ForAll("options") EmitterOptions options) {
        final String text = Yaml.serializeAll(List.of(first, second), options);
        assertThat(Yaml.parseAll(text).toList()).containsExactly(first, second);
    }

    @Property(tries = 100)
    void formatIsIdempotent(@ForAll("values") YamlValue value, @ForAll("options") EmitterOptions options) {
        final String once = Yaml.serialize(value, options);
        assertThat(Yaml.format(once, options)).isEqualTo(once);
    }
}
