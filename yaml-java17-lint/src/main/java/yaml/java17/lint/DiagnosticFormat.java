package yaml.java17.lint;

/// Output formats of {@link YamlLint#formatDiagnostics}.
public enum DiagnosticFormat {
    /// Human readable report with source excerpts and caret underlines.
    TEXT,
    /// A JSON array with one object per diagnostic.
    JSON
}
