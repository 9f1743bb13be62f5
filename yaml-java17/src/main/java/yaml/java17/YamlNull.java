package yaml.java17;

/// The YAML null value (`~`, `null`, or an empty node).
public record YamlNull() implements YamlValue {

    private static final YamlNull INSTANCE = new YamlNull();

    public static YamlNull of() {
        return INSTANCE;
    }

    @Override
    public String kind() {
        return "null";
    }

    @Override
    public boolean isNull() {
        return true;
    }

    @Override
    public String toString() {
        return "null";
    }
}
