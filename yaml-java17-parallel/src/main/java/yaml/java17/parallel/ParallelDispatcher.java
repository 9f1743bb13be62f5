package yaml.java17.parallel;

import yaml.java17.ErrorMode;
import yaml.java17.YamlComposer;
import yaml.java17.YamlDocument;
import yaml.java17.YamlException;
import yaml.java17.YamlScanner;
import yaml.java17.YamlValue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/// Parses document ranges of one source on a fixed pool of daemon threads.
///
/// Every worker scans its range of the shared source in place, so locations in errors are those of
/// the whole source. Results are collected in range order; the first range that fails, in that
/// order, ends the call and the tasks not yet finished are cancelled. The pool lives for one call.
final class ParallelDispatcher {

    private static final Logger LOG = Logger.getLogger(ParallelDispatcher.class.getName());

    private static final AtomicInteger POOLS = new AtomicInteger();

    private final ParallelConfig config;

    ParallelDispatcher(ParallelConfig config) {
        this.config = config;
    }

    List<YamlValue> dispatch(String source, List<DocumentRange> ranges) {
        if (ranges.isEmpty()) {
            return List.of();
        }
        if (ranges.size() == 1) {
            LOG.fine(() -> "single document, parsing inline");
            try {
                return List.copyOf(parseRange(source, ranges.get(0)));
            } catch (YamlException e) {
                throw new YamlParallelException(0, e);
            }
        }
        final int threads = Math.min(config.threadCount(), ranges.size());
        LOG.fine(() -> "dispatching " + ranges.size() + " documents to " + threads + " threads");
        final ExecutorService executor = newPool(threads);
        try {
            final List<Future<List<YamlValue>>> futures = new ArrayList<>(ranges.size());
            for (DocumentRange range : ranges) {
                futures.add(executor.submit(() -> parseRange(source, range)));
            }
            final List<YamlValue> values = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                try {
                    values.addAll(futures.get(i).get());
                } catch (ExecutionException e) {
                    cancelFrom(futures, i + 1);
                    throw failure(ranges.get(i), e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    cancelFrom(futures, i);
                    throw new CancellationException("interrupted while waiting for document " + i);
                }
            }
            return List.copyOf(values);
        } finally {
            executor.shutdownNow();
        }
    }

    static List<YamlValue> parseRange(String source, DocumentRange range) {
        LOG.finer(() -> "parsing document " + range.index() + " at " + range.origin() + " chars=" + range.length());
        final YamlScanner scanner = new YamlScanner(source, range.start(), range.end(), range.origin(),
                ErrorMode.FAIL_FAST);
        final List<YamlValue> values = new ArrayList<>(1);
        for (YamlDocument document : new YamlComposer(scanner, ErrorMode.FAIL_FAST).composeAll()) {
            values.add(document.root());
        }
        return values;
    }

    private static ExecutorService newPool(int threads) {
        final int pool = POOLS.incrementAndGet();
        final AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            final Thread t = new Thread(r, "yaml-parallel-" + pool + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private static void cancelFrom(List<? extends Future<?>> futures, int from) {
        for (int i = from; i < futures.size(); i++) {
            futures.get(i).cancel(true);
        }
    }

    private static RuntimeException failure(DocumentRange range, Throwable cause) {
        if (cause instanceof YamlException e) {
            LOG.fine(() -> "document " + range.index() + " failed: " + e.getMessage());
            return new YamlParallelException(range.index(), e);
        }
        LOG.warning(() -> "unexpected failure in document " + range.index() + ": " + cause);
        if (cause instanceof RuntimeException e) {
            return e;
        }
        if (cause instanceof Error e) {
            throw e;
        }
        return new IllegalStateException("document " + range.index() + " failed", cause);
    }
}
