package yaml.java17.lint;

import java.util.List;

/// A check over one analyzed source.
///
/// Rules are stateless and report with their default severity; {@link YamlLinter} applies the
/// configured overrides, sorting and cap.
public interface LintRule {

    /// {@return the kebab-case id used in configuration and output}
    String id();

    Severity defaultSeverity();

    /// {@return whether the rule runs without being enabled explicitly}
    default boolean enabledByDefault() {
        return true;
    }

    List<Diagnostic> check(LintContext context);
}
