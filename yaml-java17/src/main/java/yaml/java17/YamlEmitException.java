package yaml.java17;

/// A value graph that cannot be written as YAML text.
public final class YamlEmitException extends YamlException {

    private static final long serialVersionUID = 1L;

    public YamlEmitException(String message) {
        super(message);
    }

    @Override
    public String problem() {
        return getMessage();
    }
}
