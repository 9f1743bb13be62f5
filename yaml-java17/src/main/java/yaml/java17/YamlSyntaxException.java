package yaml.java17;

import java.util.Objects;

/// Malformed YAML grammar detected by the scanner.
public final class YamlSyntaxException extends YamlException {

    private static final long serialVersionUID = 1L;

    private final String problem;
    private final Location location;
    private final Reason reason;

    public YamlSyntaxException(Reason reason, String problem, Location location) {
        super(formatMessage(problem, location));
        this.reason = Objects.requireNonNull(reason, "reason");
        this.problem = Objects.requireNonNull(problem, "problem");
        this.location = Objects.requireNonNull(location, "location");
    }

    @Override
    public String problem() {
        return problem;
    }

    public Location location() {
        return location;
    }

    public Reason reason() {
        return reason;
    }

    private static String formatMessage(String problem, Location location) {
        if (location == null) {
            return problem;
        }
        return problem + " at line " + location.line() + ", column " + location.column();
    }

    /// Classifies syntax problems so that callers (the linter in particular) can tell a
    /// style-level defect from a structural one.
    public enum Reason {
        UNEXPECTED_CHARACTER,
        UNEXPECTED_END,
        BAD_INDENTATION,
        TAB_INDENTATION,
        UNTERMINATED_SCALAR,
        INVALID_ESCAPE,
        INVALID_BLOCK_HEADER,
        INVALID_DIRECTIVE,
        UNCLOSED_FLOW,
        DEPTH_LIMIT,
        MULTIPLE_DOCUMENTS
    }
}
