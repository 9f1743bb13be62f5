package yaml.java17.lint;

import yaml.java17.YamlSemanticException;

import java.util.ArrayList;
import java.util.List;

/// Reports one kind of problem recorded by the composer.
final class SemanticProblemRule implements LintRule {

    static final String DUPLICATE_KEY = "duplicate-key";
    static final String UNDEFINED_ALIAS = "undefined-alias";
    static final String DUPLICATE_ANCHOR = "duplicate-anchor";
    static final String INVALID_TAGGED_VALUE = "invalid-tagged-value";

    private final YamlSemanticException.Reason reason;
    private final String id;

    SemanticProblemRule(YamlSemanticException.Reason reason) {
        this.reason = reason;
        this.id = switch (reason) {
            case DUPLICATE_KEY -> DUPLICATE_KEY;
            case UNDEFINED_ALIAS -> UNDEFINED_ALIAS;
            case DUPLICATE_ANCHOR -> DUPLICATE_ANCHOR;
            case INVALID_TAGGED_VALUE -> INVALID_TAGGED_VALUE;
        };
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Severity defaultSeverity() {
        return Severity.ERROR;
    }

    @Override
    public List<Diagnostic> check(LintContext context) {
        final List<Diagnostic> out = new ArrayList<>();
        for (YamlSemanticException problem : context.semanticProblems()) {
            if (problem.reason() != reason) {
                continue;
            }
            Diagnostic diagnostic = context.diagnostic(this, problem.problem(), problem.span());
            if (problem.related().isPresent()) {
                diagnostic = diagnostic.withLabel(problem.related().get(),
                        reason == YamlSemanticException.Reason.DUPLICATE_ANCHOR
                                ? "anchor first defined here" : "first defined here");
            }
            if (reason == YamlSemanticException.Reason.DUPLICATE_KEY) {
                diagnostic = diagnostic.withSuggestion("remove this duplicate key or rename it", problem.span(), null);
            }
            out.add(diagnostic);
        }
        return out;
    }
}
