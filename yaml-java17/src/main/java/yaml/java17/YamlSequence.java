package yaml.java17;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/// An ordered list of values.
///
/// ```java
/// YamlSequence seq = YamlSequence.of(List.of(YamlString.of("a"), YamlInt.of(1)));
/// ```
public record YamlSequence(List<YamlValue> values) implements YamlValue {

    public YamlSequence {
        Objects.requireNonNull(values, "values must not be null");
        values = List.copyOf(values);
    }

    public static YamlSequence of(List<? extends YamlValue> values) {
        return new YamlSequence(List.copyOf(values));
    }

    public static YamlSequence of(YamlValue... values) {
        return new YamlSequence(List.of(values));
    }

    @Override
    public String kind() {
        return "seq";
    }

    @Override
    public List<YamlValue> elements() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return values.stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]"));
    }
}
