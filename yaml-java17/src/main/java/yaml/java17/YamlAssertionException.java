package yaml.java17;

/// Thrown when a typed accessor is used on a value of a different kind, or when a
/// mapping key or sequence index is absent.
public final class YamlAssertionException extends YamlException {

    private static final long serialVersionUID = 1L;

    public YamlAssertionException(String message) {
        super(message);
    }

    @Override
    public String problem() {
        return getMessage();
    }

    static YamlAssertionException typeError(YamlValue value, String expected) {
        return new YamlAssertionException(
                "%s is not a %s.".formatted(value.getClass().getSimpleName(), expected));
    }
}
