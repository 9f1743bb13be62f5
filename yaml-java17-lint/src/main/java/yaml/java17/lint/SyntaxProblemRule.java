package yaml.java17.lint;

import yaml.java17.Span;
import yaml.java17.YamlSyntaxException;

import java.util.ArrayList;
import java.util.List;

/// Reports the problems the scanner recorded. Tab indentation has a rule of its own so that it
/// can be switched off or downgraded separately from structural errors.
final class SyntaxProblemRule implements LintRule {

    static final String SYNTAX_ERROR = "syntax-error";
    static final String TAB_INDENTATION = "tab-indentation";

    private final boolean tabs;

    private SyntaxProblemRule(boolean tabs) {
        this.tabs = tabs;
    }

    static SyntaxProblemRule syntaxError() {
        return new SyntaxProblemRule(false);
    }

    static SyntaxProblemRule tabIndentation() {
        return new SyntaxProblemRule(true);
    }

    @Override
    public String id() {
        return tabs ? TAB_INDENTATION : SYNTAX_ERROR;
    }

    @Override
    public Severity defaultSeverity() {
        return tabs ? Severity.WARNING : Severity.ERROR;
    }

    @Override
    public List<Diagnostic> check(LintContext context) {
        final List<Diagnostic> out = new ArrayList<>();
        for (YamlSyntaxException problem : context.syntaxProblems()) {
            if ((problem.reason() == YamlSyntaxException.Reason.TAB_INDENTATION) != tabs) {
                continue;
            }
            Diagnostic diagnostic = context.diagnostic(this, problem.problem(), pointAt(context, problem));
            if (tabs) {
                diagnostic = diagnostic.withSuggestion("indent with spaces", diagnostic.span(), " ");
            }
            out.add(diagnostic);
        }
        return out;
    }

    /// A one-char span at the problem, or an empty one at the end of the source.
    private static Span pointAt(LintContext context, YamlSyntaxException problem) {
        final int offset = problem.location().offset();
        final String source = context.source();
        if (offset >= source.length() || source.charAt(offset) == '\n' || source.charAt(offset) == '\r') {
            return Span.at(problem.location());
        }
        return new Span(problem.location(), context.location(offset + 1));
    }
}
