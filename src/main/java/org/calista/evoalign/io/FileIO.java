package org.calista.evoalign.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.*;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.time.Duration;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * FileIO: единая точка I/O в проекте.
 *
 * Governance-специфика:
 * - repo root как baseDir, безопасный resolve (anti path traversal) для путей из конфига
 * - lenient чтение текстов корпусов (битые байты игнорируются, скан не падает)
 * - детерминированный рекурсивный обход (sorted) с фильтром по суффиксу
 * - атомарные коммиты + (опционально) fsync для конфига
 * - блокировки для конкурентной записи jsonl журнала проверок
 *
 * Без внешних зависимостей (кроме логгера).
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    // ----------------------------
    // Options / Builder
    // ----------------------------

    public static final class Options {
        public final Charset charset;
        public final boolean atomicWrites;
        public final boolean fsyncOnCommit;
        public final boolean lockWrites;
        public final Duration lockTimeout;
        public final int ioBufferSize;

        private Options(Builder b) {
            this.charset = b.charset;
            this.atomicWrites = b.atomicWrites;
            this.fsyncOnCommit = b.fsyncOnCommit;
            this.lockWrites = b.lockWrites;
            this.lockTimeout = b.lockTimeout;
            this.ioBufferSize = b.ioBufferSize;
        }

        public static Builder builder() {
            return new Builder();
        }

        public static final class Builder {
            private Charset charset = StandardCharsets.UTF_8;
            private boolean atomicWrites = true;
            private boolean fsyncOnCommit = false;
            private boolean lockWrites = true;    // журнал проверок может писаться из нескольких CI job'ов
            private Duration lockTimeout = Duration.ofSeconds(3);
            private int ioBufferSize = 8 * 1024;

            public Builder charset(Charset v) {
                this.charset = Objects.requireNonNull(v);
                return this;
            }

            public Builder atomicWrites(boolean v) {
                this.atomicWrites = v;
                return this;
            }

            public Builder fsyncOnCommit(boolean v) {
                this.fsyncOnCommit = v;
                return this;
            }

            public Builder lockWrites(boolean v) {
                this.lockWrites = v;
                return this;
            }

            public Builder lockTimeout(Duration v) {
                this.lockTimeout = Objects.requireNonNull(v);
                return this;
            }

            public Options build() {
                return new Options(this);
            }
        }
    }

    private final Path baseDir;
    private final Options opt;

    public FileIO(Path baseDir) {
        this(baseDir, Options.builder().build());
    }

    public FileIO(Path baseDir, Charset charset, boolean atomicWrites) {
        this(baseDir, Options.builder()
                .charset(Objects.requireNonNull(charset, "charset"))
                .atomicWrites(atomicWrites)
                .build());
    }

    public FileIO(Path baseDir, Options options) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.opt = Objects.requireNonNull(options, "options");
        log.debug("FileIO init: baseDir={}, charset={}, atomicWrites={}, fsyncOnCommit={}, lockWrites={}",
                this.baseDir, opt.charset, opt.atomicWrites, opt.fsyncOnCommit, opt.lockWrites);
    }

    // ----------------------------
    // Base dir / Resolve
    // ----------------------------

    public Path baseDir() {
        return baseDir;
    }

    /**
     * Резолвит относительный путь внутри baseDir и защищает от выхода через "..".
     * Абсолютные пути запрещены. Обратные слеши приводятся к прямым.
     */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        String sanitized = relative.replace('\\', '/');
        Path rel = Paths.get(sanitized);
        if (rel.isAbsolute()) throw new IllegalArgumentException("resolve(relative) does not accept absolute paths: " + relative);

        Path p = baseDir.resolve(rel).normalize().toAbsolutePath();
        if (!p.startsWith(baseDir)) throw new IllegalArgumentException("Path traversal detected: " + relative);
        return p;
    }

    /**
     * Repo-relative name with forward slashes; used for scan indexes and reports.
     */
    public String relativeName(Path file) {
        Objects.requireNonNull(file, "file");
        Path abs = file.toAbsolutePath().normalize();
        Path rel = abs.startsWith(baseDir) ? baseDir.relativize(abs) : abs;
        return rel.toString().replace('\\', '/');
    }

    private void ensureParentDir(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    // ----------------------------
    // Existence / Stat
    // ----------------------------

    public boolean exists(Path file) {
        Objects.requireNonNull(file, "file");
        return Files.exists(file);
    }

    // ----------------------------
    // Text
    // ----------------------------

    public String readString(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.readString(file, opt.charset);
    }

    /**
     * Reads text ignoring malformed/unmappable input instead of failing.
     * Corpus files are scanned as-is; a stray byte must not hide the rest of the file.
     */
    public String readStringLenient(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        byte[] bytes = Files.readAllBytes(file);
        CharsetDecoder dec = opt.charset.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE);
        try {
            CharBuffer cb = dec.decode(ByteBuffer.wrap(bytes));
            return cb.toString();
        } catch (CharacterCodingException e) {
            throw new IOException("Failed to decode " + file, e);
        }
    }

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(content, "content");
        ensureParentDir(file);

        if (!opt.atomicWrites) {
            writeStringDirect(file, content);
            return;
        }

        Path tmp = tempSibling(file);
        writeStringDirect(tmp, content);
        atomicCommit(tmp, file);
    }

    private void appendLine(Path file, String line) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(line, "line");
        ensureParentDir(file);

        if (!opt.lockWrites) {
            Files.writeString(file, line + System.lineSeparator(), opt.charset,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
            return;
        }

        withWriteLock(file, () -> Files.writeString(file, line + System.lineSeparator(), opt.charset,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND));
    }

    // ----------------------------
    // JSONL helpers
    // ----------------------------

    public void appendJsonl(Path file, String jsonLine) throws IOException {
        Objects.requireNonNull(jsonLine, "jsonLine");
        String s = jsonLine.trim();
        if (s.isEmpty()) return;
        appendLine(file, s);
    }

    /**
     * JSONL записи в память (trim + skip empty).
     */
    public List<String> readJsonl(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        try (Stream<String> s = Files.lines(file, opt.charset)) {
            return s.map(String::trim)
                    .filter(x -> !x.isEmpty())
                    .collect(Collectors.toList());
        }
    }

    // ----------------------------
    // Streams
    // ----------------------------

    /**
     * Buffered stream sized by {@link Options#ioBufferSize}. Caller closes.
     */
    public InputStream openInputStream(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return new BufferedInputStream(Files.newInputStream(file), opt.ioBufferSize);
    }

    // ----------------------------
    // Listing
    // ----------------------------

    /**
     * Recursive regular-file walk, filtered by suffix (".json", ...), sorted by path.
     * Missing directory yields an empty list. Empty suffix set means "all files".
     */
    public List<Path> walk(Path dir, Set<String> suffixes) throws IOException {
        Objects.requireNonNull(dir, "dir");
        Objects.requireNonNull(suffixes, "suffixes");
        if (!Files.isDirectory(dir)) return List.of();

        try (Stream<Path> s = Files.walk(dir)) {
            return s.filter(Files::isRegularFile)
                    .filter(p -> suffixes.isEmpty() || suffixes.contains(suffixOf(p)))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /**
     * Non-recursive listing of a directory with one suffix, sorted.
     */
    public List<Path> list(Path dir, String suffix) throws IOException {
        Objects.requireNonNull(dir, "dir");
        Objects.requireNonNull(suffix, "suffix");
        if (!Files.isDirectory(dir)) return List.of();
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(Files::isRegularFile)
                    .filter(p -> suffix.equals(suffixOf(p)))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /**
     * Suffix including the dot, as written (".json"); "" when the name has none.
     */
    public static String suffixOf(Path file) {
        Path name = file.getFileName();
        if (name == null) return "";
        String n = name.toString();
        int dot = n.lastIndexOf('.');
        if (dot <= 0) return "";
        return n.substring(dot);
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private Path tempSibling(Path target) {
        String name = target.getFileName().toString();
        return target.resolveSibling("." + name + ".tmp-" + Long.toHexString(System.nanoTime()));
    }

    private void writeStringDirect(Path file, String content) throws IOException {
        try (BufferedWriter w = Files.newBufferedWriter(file, opt.charset,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            w.write(content);
        }
    }

    private void atomicCommit(Path tmp, Path target) throws IOException {
        if (opt.fsyncOnCommit) fsyncFile(tmp);

        try {
            Files.move(tmp, target,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
            log.trace("atomicCommit: {} -> {} (ATOMIC)", tmp, target);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            log.trace("atomicCommit: {} -> {} (NON-ATOMIC fallback)", tmp, target);
        } finally {
            // move не удался, tmp может остаться
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanupErr) {
                log.debug("tmp cleanup failed for {}: {}", tmp, cleanupErr.toString());
            }
        }
    }

    private void fsyncFile(Path file) {
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
            ch.force(true);
        } catch (IOException e) {
            log.debug("fsyncFile ignored for {}: {}", file, e.toString());
        }
    }

    private void withWriteLock(Path file, IoRunnable action) throws IOException {
        ensureParentDir(file);
        if (!Files.exists(file)) {
            try {
                Files.createFile(file);
            } catch (FileAlreadyExistsException raced) {
                log.trace("lock file created concurrently: {}", file);
            }
        }

        long deadlineNs = System.nanoTime() + opt.lockTimeout.toNanos();

        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.WRITE)) {
            while (true) {
                try {
                    FileLock lock = ch.tryLock();
                    if (lock != null) {
                        try (lock) {
                            action.run();
                            if (opt.fsyncOnCommit) ch.force(true);
                            return;
                        }
                    }
                } catch (OverlappingFileLockException sameJvm) {
                    // внутри одного процесса, подождём
                    log.trace("lock held in-process for {}", file);
                }

                if (System.nanoTime() >= deadlineNs) {
                    throw new IOException("Write lock timeout for " + file);
                }
                sleepQuiet(10);
            }
        }
    }

    private static void sleepQuiet(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    @FunctionalInterface
    private interface IoRunnable {
        void run() throws IOException;
    }
}
