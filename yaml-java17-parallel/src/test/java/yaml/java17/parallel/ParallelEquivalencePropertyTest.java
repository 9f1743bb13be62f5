package yaml.java17.parallel;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;
import yaml.java17.EmitterOptions;
import yaml.java17.Yaml;
import yaml.java17.YamlBool;
import yaml.java17.YamlFloat;
import yaml.java17.YamlInt;
import yaml.java17.YamlMapping;
import yaml.java17.YamlNull;
import yaml.java17.YamlSequence;
import yaml.java17.YamlString;
import yaml.java17.YamlValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/// `splitAndParse` returns what a sequential `parseAll` returns, for any thread count.
class ParallelEquivalencePropertyTest extends ParallelLoggingConfig {

    private static final List<String> SEPARATORS = List.of("---\n", "...\n---\n", "# next\n---\n", "...\n");

    @Provide
    Arbitrary<YamlValue> documents() {
        return value(2);
    }

    private static Arbitrary<YamlValue> value(int depth) {
        final Arbitrary<YamlValue> scalar = Arbitraries.oneOf(
                Arbitraries.just(YamlNull.of()),
                Arbitraries.of(true, false).map(YamlBool::of),
                Arbitraries.longs().map(YamlInt::of),
                Arbitraries.doubles().map(YamlFloat::of),
                Arbitraries.of("---", "...", "it's", "[x", "\"q", "a\n---\nb", "# c", "|", "%YAML").map(YamlString::of),
                Arbitraries.strings().withChars("ab '\"[]{}#-.:\n").ofMaxLength(12).map(YamlString::of));
        if (depth == 0) {
            return scalar;
        }
        final Arbitrary<YamlValue> sequence = value(depth - 1).list().ofMaxSize(3).map(v -> (YamlValue) YamlSequence.of(v));
        final Arbitrary<YamlValue> mapping = Arbitraries.strings().alpha().ofMinLength(1).ofMaxLength(4)
                .flatMap(key -> value(depth - 1).map(v -> YamlMapping.Entry.of(key, v)))
                .list().ofMaxSize(3)
                .map(entries -> {
                    final Map<YamlValue, YamlMapping.Entry> unique = new LinkedHashMap<>();
                    entries.forEach(e -> unique.putIfAbsent(e.key(), e));
                    return (YamlValue) YamlMapping.of(new ArrayList<>(unique.values()));
                });
        return Arbitraries.oneOf(scalar, sequence, mapping);
    }

    @Provide
    Arbitrary<String> separators() {
        return Arbitraries.of(SEPARATORS);
    }

    @Property(tries = 200)
    void parallelEqualsSequential(@ForAll("documents") YamlValue first,
                                  @ForAll("documents") YamlValue second,
                                  @ForAll("documents") YamlValue third,
                                  @ForAll("separators") String separator,
                                  @ForAll boolean flow,
                                  @ForAll @IntRange(min = 1, max = 8) int threads) {
        final EmitterOptions options = EmitterOptions.defaults().withDefaultFlowStyle(flow);
        final String source = String.join(separator,
                Yaml.serialize(first, options), Yaml.serialize(second, options), Yaml.serialize(third, options));
        final List<YamlValue> sequential = Yaml.parseAll(source).toList();
        final List<YamlValue> parallel = YamlParallel.splitAndParse(source, ParallelConfig.defaults().withThreadCount(threads));
        assertThat(parallel).isEqualTo(sequential);
        assertThat(parallel).containsExactly(first, second, third);
    }
}
