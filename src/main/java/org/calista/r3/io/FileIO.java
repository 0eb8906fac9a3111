package org.calista.r3.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * FileIO — single I/O entry point of the engine.
 *
 * <ul>
 *   <li>sandboxed resolve inside baseDir (no ".." escapes)</li>
 *   <li>atomic commits through a temp sibling + optional fsync</li>
 *   <li>JSONL append/stream for records, events and snapshots</li>
 *   <li>writer handles with commit/rollback for multi-line documents</li>
 * </ul>
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    private final Path baseDir;
    private final Charset charset;
    private final boolean atomicWrites;
    private final boolean fsyncOnCommit;

    public FileIO(Path baseDir) {
        this(baseDir, StandardCharsets.UTF_8, true);
    }

    public FileIO(Path baseDir, Charset charset, boolean atomicWrites) {
        this(baseDir, charset, atomicWrites, false);
    }

    public FileIO(Path baseDir, Charset charset, boolean atomicWrites, boolean fsyncOnCommit) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.charset = Objects.requireNonNull(charset, "charset");
        this.atomicWrites = atomicWrites;
        this.fsyncOnCommit = fsyncOnCommit;
        log.debug("FileIO init: baseDir={}, charset={}, atomicWrites={}, fsyncOnCommit={}",
                this.baseDir, charset, atomicWrites, fsyncOnCommit);
        try {
            ensureBaseDir();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to ensure base directory exists: " + this.baseDir, e);
        }
    }

    // ----------------------------
    // Base dir / Resolve
    // ----------------------------

    public Path baseDir() {
        return baseDir;
    }

    public void ensureBaseDir() throws IOException {
        Files.createDirectories(baseDir);
    }

    /**
     * Resolves a relative path inside baseDir. Absolute paths and traversal outside baseDir are rejected.
     */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        Path rel = Paths.get(relative.replace('\\', '/'));
        if (rel.isAbsolute()) throw new IllegalArgumentException("resolve(relative) does not accept absolute paths: " + relative);

        Path p = baseDir.resolve(rel).normalize().toAbsolutePath();
        if (!p.startsWith(baseDir)) throw new IllegalArgumentException("Path traversal detected: " + relative);
        return p;
    }

    public void ensureParentDir(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    public boolean exists(Path file) {
        Objects.requireNonNull(file, "file");
        return Files.exists(file);
    }

    // ----------------------------
    // Text
    // ----------------------------

    public String readString(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.readString(file, charset);
    }

    public Optional<String> readStringIfExists(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) return Optional.empty();
        return Optional.of(readString(file));
    }

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(content, "content");
        ensureParentDir(file);

        if (!atomicWrites) {
            Files.writeString(file, content, charset, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            return;
        }

        Path tmp = tempSibling(file);
        Files.writeString(tmp, content, charset, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        atomicCommit(tmp, file);
    }

    public void appendLine(Path file, String line) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(line, "line");
        ensureParentDir(file);
        Files.writeString(file, line + System.lineSeparator(), charset,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    // ----------------------------
    // JSONL helpers
    // ----------------------------

    public void appendJsonl(Path file, String jsonLine) throws IOException {
        Objects.requireNonNull(jsonLine, "jsonLine");
        String s = jsonLine.trim();
        if (s.isEmpty()) return;
        if (s.indexOf('\n') >= 0) throw new IllegalArgumentException("JSONL record must be a single line: " + file);
        appendLine(file, s);
    }

    /** Small JSONL files into memory. Missing file reads as empty. */
    public List<String> readJsonl(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) return List.of();
        try (Stream<String> s = jsonlStream(file)) {
            List<String> out = s.collect(Collectors.toList());
            log.debug("readJsonl: {} ({} records)", file, out.size());
            return out;
        }
    }

    /** JSONL records (trimmed, empty lines skipped). The stream must be closed. */
    public Stream<String> jsonlStream(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.lines(file, charset)
                .map(x -> x == null ? "" : x.trim())
                .filter(x -> !x.isEmpty());
    }

    // ----------------------------
    // Writer handles
    // ----------------------------

    /**
     * Opens a writer. With atomicWrites the content goes to a temp sibling until {@link #commit(WriterHandle)}.
     */
    public WriterHandle openWriter(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        ensureParentDir(file);

        Path target = atomicWrites ? tempSibling(file) : file;
        BufferedWriter w = Files.newBufferedWriter(target, charset,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return new WriterHandle(file, atomicWrites ? target : null, w);
    }

    public void commit(WriterHandle h) throws IOException {
        Objects.requireNonNull(h, "handle");
        try {
            h.writer.close();
        } catch (IOException e) {
            log.error("commit: failed to close writer for {}", h.targetFile, e);
            throw e;
        }
        if (h.tmpFile != null) atomicCommit(h.tmpFile, h.targetFile);
    }

    public void rollback(WriterHandle h) {
        if (h == null) return;
        try {
            h.writer.close();
        } catch (IOException e) {
            log.debug("rollback: close failed for {}: {}", h.targetFile, e.toString());
        }
        if (h.tmpFile != null) {
            try {
                Files.deleteIfExists(h.tmpFile);
            } catch (IOException e) {
                log.warn("rollback: failed to delete tmp {}", h.tmpFile, e);
            }
        }
    }

    public static final class WriterHandle {
        public final Path targetFile;
        public final Path tmpFile; // null without atomicWrites
        public final BufferedWriter writer;

        private WriterHandle(Path targetFile, Path tmpFile, BufferedWriter writer) {
            this.targetFile = targetFile;
            this.tmpFile = tmpFile;
            this.writer = writer;
        }
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private static Path tempSibling(Path target) {
        return target.resolveSibling(target.getFileName().toString() + ".tmp");
    }

    private void atomicCommit(Path tmp, Path target) throws IOException {
        if (fsyncOnCommit) fsync(tmp);
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.trace("atomicCommit: {} -> {} (ATOMIC)", tmp, target);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            log.trace("atomicCommit: {} -> {} (NON-ATOMIC fallback)", tmp, target);
        } finally {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                log.debug("atomicCommit: tmp cleanup failed for {}: {}", tmp, e.toString());
            }
        }
    }

    private static void fsync(Path file) {
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
            ch.force(true);
        } catch (IOException e) {
            log.debug("fsync ignored for {}: {}", file, e.toString());
        }
    }
}
