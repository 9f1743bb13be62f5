package yaml.java17;

/// Input rejected before any parsing work started because it exceeds a configured cap.
/// Carries the violated limit and the observed value instead of a source location.
public final class YamlValidationException extends YamlException {

    private static final long serialVersionUID = 1L;

    private final String limit;
    private final long configured;
    private final long observed;

    public YamlValidationException(String limit, long configured, long observed) {
        super(limit + " exceeded: observed " + observed + ", limit " + configured);
        this.limit = limit;
        this.configured = configured;
        this.observed = observed;
    }

    @Override
    public String problem() {
        return getMessage();
    }

    /// The name of the violated limit, e.g. `maxInputSize`.
    public String limit() {
        return limit;
    }

    public long configured() {
        return configured;
    }

    public long observed() {
        return observed;
    }
}
