package yaml.java17.parallel;

import yaml.java17.YamlException;

/// A document of a parallel parse failed. The cause is the error that document raised.
public final class YamlParallelException extends YamlException {

    private static final long serialVersionUID = 1L;

    private final int documentIndex;

    public YamlParallelException(int documentIndex, YamlException cause) {
        super("document " + documentIndex + " failed: " + cause.getMessage(), cause);
        this.documentIndex = documentIndex;
    }

    @Override
    public String problem() {
        return "document " + documentIndex + " failed: " + getCause().problem();
    }

    /// The position of the failing document in the stream, from 0.
    public int documentIndex() {
        return documentIndex;
    }

    @Override
    public synchronized YamlException getCause() {
        return (YamlException) super.getCause();
    }
}
