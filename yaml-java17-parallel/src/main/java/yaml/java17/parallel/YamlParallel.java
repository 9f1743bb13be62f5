package yaml.java17.parallel;

import yaml.java17.YamlValidationException;
import yaml.java17.YamlValue;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Parses the documents of a multi-document stream on several threads.
///
/// The result equals `Yaml.parseAll(source).toList()`. Inputs over the configured size or
/// document count are rejected with {@link YamlValidationException} before any parsing starts;
/// a malformed document raises {@link YamlParallelException} naming its index.
///
/// ```java
/// final List<YamlValue> events = YamlParallel.splitAndParse(text, ParallelConfig.defaults().withThreadCount(4));
/// ```
public final class YamlParallel {

    private static final Logger LOG = Logger.getLogger(YamlParallel.class.getName());

    private YamlParallel() {
    }

    public static List<YamlValue> splitAndParse(String source) {
        return splitAndParse(source, ParallelConfig.defaults());
    }

    public static List<YamlValue> splitAndParse(String source, ParallelConfig config) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(config, "config must not be null");
        checkInputSize(utf8Length(source), config);
        return dispatch(source, config);
    }

    /// Checks the byte length before decoding, so an oversized input is never copied into a string.
    public static List<YamlValue> splitAndParse(byte[] utf8, ParallelConfig config) {
        Objects.requireNonNull(utf8, "utf8 must not be null");
        Objects.requireNonNull(config, "config must not be null");
        checkInputSize(utf8.length, config);
        return dispatch(new String(utf8, StandardCharsets.UTF_8), config);
    }

    private static List<YamlValue> dispatch(String source, ParallelConfig config) {
        final List<DocumentRange> ranges = DocumentSplitter.split(source);
        if (ranges.size() > config.maxDocumentCount()) {
            throw new YamlValidationException("maxDocumentCount", config.maxDocumentCount(), ranges.size());
        }
        LOG.fine(() -> "splitAndParse chars=" + source.length() + " documents=" + ranges.size());
        return new ParallelDispatcher(config).dispatch(source, ranges);
    }

    private static void checkInputSize(long size, ParallelConfig config) {
        if (size > config.maxInputSize()) {
            throw new YamlValidationException("maxInputSize", config.maxInputSize(), size);
        }
    }

    /// {@return the UTF-8 encoded length of `s`, without encoding it}
    static long utf8Length(String s) {
        long length = 0;
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            if (c < 0x80) {
                length += 1;
            } else if (c < 0x800) {
                length += 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < s.length() && Character.isLowSurrogate(s.charAt(i + 1))) {
                length += 4;
                i++;
            } else if (Character.isSurrogate(c)) {
                length += 1;
            } else {
                length += 3;
            }
        }
        return length;
    }
}
