package yaml.java17;

/// How the scanner and composer react to malformed input.
public enum ErrorMode {
    /// Throw at the first problem. Used by parsing and serialization.
    FAIL_FAST,
    /// Record each problem, resynchronize and keep going. Used by the linter.
    COLLECT
}
