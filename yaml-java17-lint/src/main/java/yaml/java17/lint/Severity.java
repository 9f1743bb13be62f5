package yaml.java17.lint;

import java.util.Locale;

/// How serious a {@link Diagnostic} is. Declaration order is sort order: errors first.
public enum Severity {
    ERROR,
    WARNING,
    INFO,
    HINT;

    /// {@return the lowercase name used in rendered diagnostics}
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
