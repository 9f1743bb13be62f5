package yaml.java17;

/// Options for {@link YamlEmitter}.
///
/// @param sortKeys         emit mapping entries ordered by {@link YamlValues#ORDER}
/// @param allowUnicode     write non-ASCII characters as is; otherwise they are escaped
/// @param defaultFlowStyle emit every collection in flow style
/// @param indent           spaces per nesting level, 1 to 9
/// @param width            preferred line width for flow collections
/// @param explicitStart    start every document with `---`
public record EmitterOptions(boolean sortKeys, boolean allowUnicode, boolean defaultFlowStyle,
                             int indent, int width, boolean explicitStart) {

    public static final int DEFAULT_INDENT = 2;
    public static final int DEFAULT_WIDTH = 80;

    public EmitterOptions {
        if (indent < 1 || indent > 9) {
            throw new IllegalArgumentException("indent must be between 1 and 9: " + indent);
        }
        if (width < 1) {
            throw new IllegalArgumentException("width must be positive: " + width);
        }
    }

    public static EmitterOptions defaults() {
        return new EmitterOptions(false, false, false, DEFAULT_INDENT, DEFAULT_WIDTH, false);
    }

    public EmitterOptions withSortKeys(boolean sortKeys) {
        return new EmitterOptions(sortKeys, allowUnicode, defaultFlowStyle, indent, width, explicitStart);
    }

    public EmitterOptions withAllowUnicode(boolean allowUnicode) {
        return new EmitterOptions(sortKeys, allowUnicode, defaultFlowStyle, indent, width, explicitStart);
    }

    public EmitterOptions withDefaultFlowStyle(boolean defaultFlowStyle) {
        return new EmitterOptions(sortKeys, allowUnicode, defaultFlowStyle, indent, width, explicitStart);
    }

    public EmitterOptions withIndent(int indent) {
        return new EmitterOptions(sortKeys, allowUnicode, defaultFlowStyle, indent, width, explicitStart);
    }

    public EmitterOptions withWidth(int width) {
        return new EmitterOptions(sortKeys, allowUnicode, defaultFlowStyle, indent, width, explicitStart);
    }

    public EmitterOptions withExplicitStart(boolean explicitStart) {
        return new EmitterOptions(sortKeys, allowUnicode, defaultFlowStyle, indent, width, explicitStart);
    }
}
