package yaml.java17;

import java.util.Objects;

/// A Unicode string scalar.
public record YamlString(String value) implements YamlValue {

    public YamlString {
        Objects.requireNonNull(value, "value must not be null");
    }

    public static YamlString of(String value) {
        return new YamlString(value);
    }

    @Override
    public String kind() {
        return "str";
    }

    @Override
    public String string() {
        return value;
    }

    @Override
    public String toString() {
        return '"' + value + '"';
    }
}
