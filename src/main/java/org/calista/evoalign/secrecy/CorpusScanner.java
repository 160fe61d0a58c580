package org.calista.evoalign.secrecy;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.evoalign.io.DataFiles;
import org.calista.evoalign.io.FileIO;
import org.calista.evoalign.secrecy.extract.FingerprintExtractor;
import org.calista.evoalign.secrecy.extract.impl.JsonLinesExtractor;
import org.calista.evoalign.secrecy.extract.impl.StructuredDataExtractor;
import org.calista.evoalign.secrecy.extract.impl.TextBlockExtractor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * CorpusScanner: walks protected paths under the repo root and fingerprints every
 * supported file.
 *
 * <p>Per-file work may fan out over a worker pool; results are merged once, in sorted file
 * order, so a parallel scan equals a sequential one. Read/parse failures of single files
 * become soft errors ({@code "<file>: <message>"}) and the scan goes on.</p>
 *
 * Ownership: a pool created here is shut down by {@link #close()}; an injected pool is not.
 */
public final class CorpusScanner implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(CorpusScanner.class);

    public static final List<String> DEFAULT_PROTECTED_PATHS = List.of(
            "training/data/",
            "training/corpora/",
            "culture/chronicle/training_data/",
            "prompts/",
            "prompt_libraries/"
    );

    private final FileIO io;
    private final Map<String, FingerprintExtractor> bySuffix;
    private final ExecutorService pool; // null => sequential
    private final boolean ownsPool;
    private final long shutdownTimeoutMs;

    private CorpusScanner(Builder b) {
        this.io = b.data.io();
        this.bySuffix = Collections.unmodifiableMap(registry(b.extractors != null ? b.extractors : defaultExtractors(b.data)));
        if (b.pool != null) {
            this.pool = b.pool;
            this.ownsPool = false;
        } else {
            int par = b.parallelism <= 0 ? Runtime.getRuntime().availableProcessors() : b.parallelism;
            this.pool = par > 1 ? createPool(par, b.threadNamePrefix) : null;
            this.ownsPool = this.pool != null;
        }
        this.shutdownTimeoutMs = b.shutdownTimeoutMs;
    }

    public static Builder builder(DataFiles data) {
        return new Builder(data);
    }

    /** Suffixes with an extractor. */
    public Set<String> supportedSuffixes() {
        return bySuffix.keySet();
    }

    // ---------------------------------------------------------------------
    // Scan
    // ---------------------------------------------------------------------

    public ScanResult scan(SecrecyFingerprinter fingerprinter) {
        return scan(fingerprinter, DEFAULT_PROTECTED_PATHS);
    }

    /**
     * @param protectedPaths repo-relative directories; missing ones are skipped
     */
    public ScanResult scan(SecrecyFingerprinter fingerprinter, Collection<String> protectedPaths) {
        Objects.requireNonNull(fingerprinter, "fingerprinter");
        Collection<String> paths = protectedPaths == null ? DEFAULT_PROTECTED_PATHS : protectedPaths;

        SortedMap<String, Path> files = new TreeMap<>();
        List<String> errors = new ArrayList<>();
        for (String rel : paths) {
            if (rel == null || rel.isBlank()) continue;
            try {
                Path base = io.resolve(rel);
                for (Path f : io.walk(base, bySuffix.keySet())) {
                    files.putIfAbsent(io.relativeName(f), f);
                }
            } catch (IOException | IllegalArgumentException e) {
                errors.add(rel + ": " + describe(e));
                log.warn("Protected path not scannable: {} ({})", rel, describe(e));
            }
        }

        List<FileScan> scans = pool == null ? scanSequential(files, fingerprinter) : scanParallel(files, fingerprinter);

        SortedMap<String, SortedSet<String>> sources = new TreeMap<>();
        for (FileScan s : scans) {
            if (s.error != null) {
                errors.add(s.file + ": " + s.error);
                continue;
            }
            for (String fp : s.fingerprints) {
                sources.computeIfAbsent(fp, k -> new TreeSet<>()).add(s.file);
            }
        }

        ScanResult result = new ScanResult(sources, new ArrayList<>(files.keySet()), errors);
        log.info("Corpus scan done: paths={}, files={}, fingerprints={}, errors={}",
                paths.size(), result.scannedFiles().size(), result.fingerprints().size(), result.errors().size());
        return result;
    }

    private List<FileScan> scanSequential(SortedMap<String, Path> files, SecrecyFingerprinter fp) {
        List<FileScan> out = new ArrayList<>(files.size());
        files.forEach((rel, path) -> out.add(scanFile(rel, path, fp)));
        return out;
    }

    private List<FileScan> scanParallel(SortedMap<String, Path> files, SecrecyFingerprinter fp) {
        List<Future<FileScan>> futures = new ArrayList<>(files.size());
        files.forEach((rel, path) -> futures.add(pool.submit(() -> scanFile(rel, path, fp))));

        List<FileScan> out = new ArrayList<>(futures.size());
        try {
            for (Future<FileScan> f : futures) out.add(f.get());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new FingerprintException("Corpus scan interrupted", ie);
        } catch (ExecutionException ee) {
            futures.forEach(f -> f.cancel(true));
            throw new FingerprintException("Corpus scan worker failed: " + describe(ee.getCause()), ee.getCause());
        }
        return out;
    }

    private FileScan scanFile(String rel, Path path, SecrecyFingerprinter fp) {
        FingerprintExtractor ex = bySuffix.get(FileIO.suffixOf(path));
        try {
            return new FileScan(rel, ex.extract(path, fp), null);
        } catch (IOException | RuntimeException e) {
            log.warn("Scan error in {}: {}", rel, describe(e));
            return new FileScan(rel, List.of(), describe(e));
        }
    }

    private static String describe(Throwable t) {
        if (t == null) return "unknown error";
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? t.getClass().getSimpleName() : m;
    }

    private record FileScan(String file, List<String> fingerprints, String error) {}

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Override
    public void close() {
        if (pool == null) return;
        if (!ownsPool) {
            log.debug("CorpusScanner.close(): pool is externally owned; skipping shutdown");
            return;
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                pool.shutdownNow();
                pool.awaitTermination(Math.max(250, shutdownTimeoutMs / 2), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private static List<FingerprintExtractor> defaultExtractors(DataFiles data) {
        return List.of(
                new StructuredDataExtractor(data),
                new JsonLinesExtractor(data),
                new TextBlockExtractor(data.io())
        );
    }

    private static Map<String, FingerprintExtractor> registry(List<FingerprintExtractor> extractors) {
        Map<String, FingerprintExtractor> m = new TreeMap<>();
        for (FingerprintExtractor ex : extractors) {
            for (String s : ex.suffixes()) {
                FingerprintExtractor prev = m.putIfAbsent(s, ex);
                if (prev != null) {
                    throw new IllegalArgumentException("Two extractors claim suffix " + s);
                }
            }
        }
        return m;
    }

    private static ExecutorService createPool(int parallelism, String prefix) {
        final AtomicLong tid = new AtomicLong(1);
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, prefix + tid.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        // bounded queue + CallerRunsPolicy => backpressure on huge corpora
        return new ThreadPoolExecutor(
                parallelism,
                parallelism,
                30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(1024),
                tf,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder {
        private final DataFiles data;
        private List<FingerprintExtractor> extractors;
        private ExecutorService pool;
        private int parallelism = 1;
        private String threadNamePrefix = "corpus-scan-";
        private long shutdownTimeoutMs = 2500;

        private Builder(DataFiles data) {
            this.data = Objects.requireNonNull(data, "data");
        }

        public Builder extractors(List<FingerprintExtractor> extractors) {
            this.extractors = List.copyOf(extractors);
            return this;
        }

        /** External pool; not shut down by the scanner. */
        public Builder pool(ExecutorService pool) {
            this.pool = Objects.requireNonNull(pool, "pool");
            return this;
        }

        /** 1 => sequential, 0 => one worker per CPU. */
        public Builder parallelism(int parallelism) {
            this.parallelism = Math.max(0, parallelism);
            return this;
        }

        public Builder threadNamePrefix(String prefix) {
            if (prefix != null && !prefix.isBlank()) this.threadNamePrefix = prefix;
            return this;
        }

        public Builder shutdownTimeoutMs(long ms) {
            this.shutdownTimeoutMs = Math.max(250, ms);
            return this;
        }

        public CorpusScanner build() {
            return new CorpusScanner(this);
        }
    }
}
