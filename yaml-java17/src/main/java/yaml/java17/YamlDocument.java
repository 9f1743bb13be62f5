package yaml.java17;

import java.util.Objects;

/// One composed document of a stream.
///
/// @param root          the root value; `YamlNull` for an empty document
/// @param span          the source range of the document, markers included
/// @param explicitStart whether the document began with `---`
/// @param explicitEnd   whether the document ended with `...`
public record YamlDocument(YamlValue root, Span span, boolean explicitStart, boolean explicitEnd) {

    public YamlDocument {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(span, "span must not be null");
    }
}
