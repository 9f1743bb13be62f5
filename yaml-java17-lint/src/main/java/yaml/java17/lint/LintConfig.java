package yaml.java17.lint;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Configuration of {@link YamlLinter}.
///
/// A rule runs when it is on by default or listed in `enabledRules`, and is not listed in
/// `disabledRules`. Rule ids are checked against the known rules when the linter is built.
///
/// @param enabledRules          rules switched on in addition to the default set
/// @param disabledRules         rules switched off; wins over `enabledRules`
/// @param ruleSeverityOverrides severity to report instead of a rule's default
/// @param maxDiagnostics        keep at most this many diagnostics, after sorting
/// @param maxLineLength         the `line-length` limit, in code points
/// @param indentSize            the `indentation` step; 0 infers it from the first nested block
public record LintConfig(Set<String> enabledRules, Set<String> disabledRules,
                         Map<String, Severity> ruleSeverityOverrides, int maxDiagnostics,
                         int maxLineLength, int indentSize) {

    public static final int NO_LIMIT = Integer.MAX_VALUE;
    public static final int DEFAULT_MAX_LINE_LENGTH = 80;

    public LintConfig {
        enabledRules = Set.copyOf(Objects.requireNonNull(enabledRules, "enabledRules must not be null"));
        disabledRules = Set.copyOf(Objects.requireNonNull(disabledRules, "disabledRules must not be null"));
        ruleSeverityOverrides = Map.copyOf(
                Objects.requireNonNull(ruleSeverityOverrides, "ruleSeverityOverrides must not be null"));
        if (maxDiagnostics < 0) {
            throw new IllegalArgumentException("maxDiagnostics must not be negative: " + maxDiagnostics);
        }
        if (maxLineLength < 1) {
            throw new IllegalArgumentException("maxLineLength must be positive: " + maxLineLength);
        }
        if (indentSize < 0 || indentSize > 9) {
            throw new IllegalArgumentException("indentSize must be between 0 and 9: " + indentSize);
        }
    }

    public static LintConfig defaults() {
        return new LintConfig(Set.of(), Set.of(), Map.of(), NO_LIMIT, DEFAULT_MAX_LINE_LENGTH, 0);
    }

    public LintConfig withEnabledRule(String ruleId) {
        final Set<String> enabled = new HashSet<>(enabledRules);
        enabled.add(ruleId);
        return new LintConfig(enabled, disabledRules, ruleSeverityOverrides, maxDiagnostics, maxLineLength, indentSize);
    }

    public LintConfig withDisabledRule(String ruleId) {
        final Set<String> disabled = new HashSet<>(disabledRules);
        disabled.add(ruleId);
        return new LintConfig(enabledRules, disabled, ruleSeverityOverrides, maxDiagnostics, maxLineLength, indentSize);
    }

    public LintConfig withSeverity(String ruleId, Severity severity) {
        final Map<String, Severity> overrides = new HashMap<>(ruleSeverityOverrides);
        overrides.put(ruleId, Objects.requireNonNull(severity, "severity must not be null"));
        return new LintConfig(enabledRules, disabledRules, overrides, maxDiagnostics, maxLineLength, indentSize);
    }

    public LintConfig withMaxDiagnostics(int maxDiagnostics) {
        return new LintConfig(enabledRules, disabledRules, ruleSeverityOverrides, maxDiagnostics, maxLineLength, indentSize);
    }

    public LintConfig withMaxLineLength(int maxLineLength) {
        return new LintConfig(enabledRules, disabledRules, ruleSeverityOverrides, maxDiagnostics, maxLineLength, indentSize);
    }

    public LintConfig withIndentSize(int indentSize) {
        return new LintConfig(enabledRules, disabledRules, ruleSeverityOverrides, maxDiagnostics, maxLineLength, indentSize);
    }

    /// {@return true if the rule runs under this configuration}
    public boolean isEnabled(LintRule rule) {
        return !disabledRules.contains(rule.id()) && (rule.enabledByDefault() || enabledRules.contains(rule.id()));
    }

    /// {@return the severity the rule reports with}
    public Severity severityOf(LintRule rule) {
        return ruleSeverityOverrides.getOrDefault(rule.id(), rule.defaultSeverity());
    }
}
