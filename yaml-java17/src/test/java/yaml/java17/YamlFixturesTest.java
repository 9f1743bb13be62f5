package yaml.java17;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/// Parses every `fixtures/*.yaml` file and compares it with the JSON document of the same name.
public final class YamlFixturesTest extends YamlLoggingConfig {

    private static final Logger LOG = Logger.getLogger(YamlFixturesTest.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @ParameterizedTest(name = "{0}")
    @MethodSource("fixtures")
    void parsesLikeExpectedJson(String name) throws IOException {
        LOG.info(() -> "TEST: parsesLikeExpectedJson fixture=" + name);
        final var dir = fixturesDir();
        final YamlValue actual = Yaml.parse(Files.readAllBytes(dir.resolve(name + ".yaml")));
        final YamlValue expected = fromJson(MAPPER.readTree(dir.resolve(name + ".json").toFile()));
        assertThat(actual).isEqualTo(expected);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("fixtures")
    void reEmittedFixtureParsesBack(String name) throws IOException {
        final YamlValue value = Yaml.parse(Files.readString(fixturesDir().resolve(name + ".yaml")));
        final String text = Yaml.serialize(value, EmitterOptions.defaults().withAllowUnicode(true));
        LOG.fine(() -> name + " re-emitted:\n" + text);
        assertThat(Yaml.parse(text)).isEqualTo(value);
    }

    static Stream<String> fixtures() throws IOException {
        try (var stream = Files.list(fixturesDir())) {
            return stream
                    .map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(".yaml"))
                    .map(name -> name.substring(0, name.length() - ".yaml".length()))
                    .sorted()
                    .toList()
                    .stream();
        }
    }

    private static Path fixturesDir() {
        final String base = System.getProperty("yaml.test.resources");
        return (base == null ? Path.of("src", "test", "resources") : Path.of(base)).resolve("fixtures");
    }

    private static YamlValue fromJson(JsonNode node) {
        if (node.isNull()) {
            return YamlNull.of();
        }
        if (node.isBoolean()) {
            return YamlBool.of(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            return YamlInt.of(node.bigIntegerValue());
        }
        if (node.isNumber()) {
            return YamlFloat.of(node.doubleValue());
        }
        if (node.isTextual()) {
            return YamlString.of(node.textValue());
        }
        if (node.isArray()) {
            final List<YamlValue> values = new ArrayList<>();
            node.forEach(element -> values.add(fromJson(element)));
            return YamlSequence.of(values);
        }
        final List<YamlMapping.Entry> entries = new ArrayList<>();
        final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            final var field = fields.next();
            entries.add(YamlMapping.Entry.of(field.getKey(), fromJson(field.getValue())));
        }
        return YamlMapping.of(entries);
    }
}
