package yaml.java17;

/// Root of every failure raised while parsing, composing, emitting or dispatching YAML.
///
/// All subclasses are unchecked: malformed input is reported to the caller, not recovered from,
/// unless the pipeline runs in `ErrorMode.COLLECT`.
public abstract class YamlException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected YamlException(String message) {
        super(message);
    }

    protected YamlException(String message, Throwable cause) {
        super(message, cause);
    }

    /// The message without any location suffix.
    public abstract String problem();
}
