package yaml.java17.parallel;

/// Configuration of {@link YamlParallel#splitAndParse(String, ParallelConfig)}.
///
/// @param threadCount      the most worker threads to start, 1 to {@value #MAX_THREADS}
/// @param maxInputSize     the largest accepted input in UTF-8 bytes, at most 1 GiB
/// @param maxDocumentCount the most documents accepted in one input
public record ParallelConfig(int threadCount, long maxInputSize, int maxDocumentCount) {

    public static final int MAX_THREADS = 128;
    public static final long MAX_INPUT_SIZE = 1L << 30;
    public static final int MAX_DOCUMENT_COUNT = 10_000_000;
    public static final long DEFAULT_MAX_INPUT_SIZE = 100L << 20;
    public static final int DEFAULT_MAX_DOCUMENT_COUNT = 100_000;

    public ParallelConfig {
        if (threadCount < 1 || threadCount > MAX_THREADS) {
            throw new IllegalArgumentException("threadCount must be between 1 and " + MAX_THREADS + ": " + threadCount);
        }
        if (maxInputSize < 1 || maxInputSize > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException("maxInputSize must be between 1 and " + MAX_INPUT_SIZE + ": " + maxInputSize);
        }
        if (maxDocumentCount < 1 || maxDocumentCount > MAX_DOCUMENT_COUNT) {
            throw new IllegalArgumentException(
                    "maxDocumentCount must be between 1 and " + MAX_DOCUMENT_COUNT + ": " + maxDocumentCount);
        }
    }

    /// One thread per available processor, 100 MiB and 100,000 documents.
    public static ParallelConfig defaults() {
        return new ParallelConfig(Math.min(MAX_THREADS, Runtime.getRuntime().availableProcessors()),
                DEFAULT_MAX_INPUT_SIZE, DEFAULT_MAX_DOCUMENT_COUNT);
    }

    public ParallelConfig withThreadCount(int threadCount) {
        return new ParallelConfig(threadCount, maxInputSize, maxDocumentCount);
    }

    public ParallelConfig withMaxInputSize(long maxInputSize) {
        return new ParallelConfig(threadCount, maxInputSize, maxDocumentCount);
    }

    public ParallelConfig withMaxDocumentCount(int maxDocumentCount) {
        return new ParallelConfig(threadCount, maxInputSize, maxDocumentCount);
    }
}
