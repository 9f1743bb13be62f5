package yaml.java17.lint;

import java.util.List;
import java.util.Objects;

/// Entry points of the linter.
///
/// ```java
/// final var diagnostics = YamlLint.lint(text, LintConfig.defaults().withDisabledRule("line-length"));
/// System.out.print(YamlLint.formatDiagnostics(diagnostics, text, DiagnosticFormat.TEXT, false));
/// ```
public final class YamlLint {

    private YamlLint() {
    }

    public static List<Diagnostic> lint(String source) {
        return lint(source, LintConfig.defaults());
    }

    /// @throws IllegalArgumentException if the configuration names an unknown rule
    public static List<Diagnostic> lint(String source, LintConfig config) {
        return new YamlLinter(config).lint(source);
    }

    /// Renders diagnostics against the source they were reported on.
    ///
    /// @param useColors add ANSI colors; ignored for JSON
    public static String formatDiagnostics(List<Diagnostic> diagnostics, String source, DiagnosticFormat format,
                                           boolean useColors) {
        Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(format, "format must not be null");
        return switch (format) {
            case JSON -> JsonDiagnosticFormatter.format(diagnostics);
            case TEXT -> new TextDiagnosticFormatter(source, useColors).format(diagnostics);
        };
    }
}
