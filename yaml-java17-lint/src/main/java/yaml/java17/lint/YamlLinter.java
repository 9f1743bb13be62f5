package yaml.java17.lint;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Runs the enabled rules over a source and returns their diagnostics in a stable order.
///
/// Linting never throws for bad YAML: syntax and semantic problems come back as diagnostics.
/// Diagnostics are sorted by start offset, then severity, rule id and message, and then cut to
/// {@link LintConfig#maxDiagnostics()}. The same input and configuration always give the same list.
public final class YamlLinter {

    private static final Logger LOG = Logger.getLogger(YamlLinter.class.getName());

    static final Comparator<Diagnostic> ORDER = Comparator
            .comparingInt((Diagnostic d) -> d.span().start().offset())
            .thenComparing(Diagnostic::severity)
            .thenComparing(Diagnostic::ruleId)
            .thenComparing(Diagnostic::message);

    private final List<LintRule> rules;
    private final LintConfig config;

    public YamlLinter(LintConfig config) {
        this(LintRules.builtIn(), config);
    }

    /// @throws IllegalArgumentException if the configuration names a rule that is not in `rules`
    public YamlLinter(List<LintRule> rules, LintConfig config) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
        this.config = Objects.requireNonNull(config, "config must not be null");
        final Set<String> known = new HashSet<>();
        for (LintRule rule : this.rules) {
            if (!known.add(rule.id())) {
                throw new IllegalArgumentException("duplicate lint rule: " + rule.id());
            }
        }
        final Set<String> named = new HashSet<>(config.enabledRules());
        named.addAll(config.disabledRules());
        named.addAll(config.ruleSeverityOverrides().keySet());
        for (String id : named) {
            if (!known.contains(id)) {
                throw new IllegalArgumentException("unknown lint rule: " + id);
            }
        }
    }

    public LintConfig config() {
        return config;
    }

    public List<Diagnostic> lint(String source) {
        Objects.requireNonNull(source, "source must not be null");
        LOG.fine(() -> "lint chars=" + source.length());
        final LintContext context = LintContext.analyze(source, config);
        final List<Diagnostic> all = new ArrayList<>();
        for (LintRule rule : rules) {
            if (!config.isEnabled(rule)) {
                continue;
            }
            final Severity severity = config.severityOf(rule);
            final List<Diagnostic> found = rule.check(context);
            LOG.finer(() -> "rule " + rule.id() + " reported " + found.size());
            for (Diagnostic diagnostic : found) {
                all.add(diagnostic.severity() == severity ? diagnostic : diagnostic.withSeverity(severity));
            }
        }
        all.sort(ORDER);
        if (all.size() > config.maxDiagnostics()) {
            LOG.fine(() -> "keeping " + config.maxDiagnostics() + " of " + all.size() + " diagnostics");
            return List.copyOf(all.subList(0, config.maxDiagnostics()));
        }
        return List.copyOf(all);
    }
}
