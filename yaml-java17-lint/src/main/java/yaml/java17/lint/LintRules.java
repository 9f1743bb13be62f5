package yaml.java17.lint;

import yaml.java17.YamlSemanticException;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/// The built-in rules.
public final class LintRules {

    private static final List<LintRule> BUILT_IN = List.of(
            SyntaxProblemRule.syntaxError(),
            new SemanticProblemRule(YamlSemanticException.Reason.DUPLICATE_KEY),
            new SemanticProblemRule(YamlSemanticException.Reason.UNDEFINED_ALIAS),
            new SemanticProblemRule(YamlSemanticException.Reason.DUPLICATE_ANCHOR),
            new SemanticProblemRule(YamlSemanticException.Reason.INVALID_TAGGED_VALUE),
            SyntaxProblemRule.tabIndentation(),
            new IndentationRule(),
            new TrailingWhitespaceRule(),
            new LineLengthRule(),
            new NewLineAtEndOfFileRule(),
            new EmptyValuesRule(),
            new OctalValuesRule(),
            new DocumentStartRule());

    private static final Map<String, LintRule> BY_ID = BUILT_IN.stream()
            .collect(Collectors.toUnmodifiableMap(LintRule::id, Function.identity()));

    private LintRules() {
    }

    /// {@return every built-in rule, including those off by default}
    public static List<LintRule> builtIn() {
        return BUILT_IN;
    }

    /// {@return the built-in rule with this id}
    /// @throws IllegalArgumentException for an unknown id
    public static LintRule byId(String id) {
        final LintRule rule = BY_ID.get(id);
        if (rule == null) {
            throw new IllegalArgumentException("unknown lint rule: " + id);
        }
        return rule;
    }
}
