package yaml.java17;

/// A Core Schema boolean: only the lowercase `true` and `false` resolve to this kind.
public record YamlBool(boolean value) implements YamlValue {

    private static final YamlBool TRUE = new YamlBool(true);
    private static final YamlBool FALSE = new YamlBool(false);

    public static YamlBool of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public String kind() {
        return "bool";
    }

    @Override
    public boolean bool() {
        return value;
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
