package org.calista.r3.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.r3.io.FileIO;
import org.calista.r3.state.EngineSnapshot;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * StateSnapshotStore — persist/load {@link EngineSnapshot} as a single pretty JSON document.
 *
 * <p>Writes go through a temp file and an atomic move, so a crash never leaves a half-written
 * snapshot behind.</p>
 */
public final class StateSnapshotStore {

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path snapshotFile;

    public StateSnapshotStore(FileIO io, ObjectMapper mapper, Path snapshotFile) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.snapshotFile = Objects.requireNonNull(snapshotFile, "snapshotFile");
    }

    public void save(EngineSnapshot snapshot) throws IOException {
        Objects.requireNonNull(snapshot, "snapshot");

        FileIO.WriterHandle h = io.openWriter(snapshotFile);
        try {
            h.writer.write(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot));
            h.writer.newLine();
            io.commit(h);
        } catch (IOException | RuntimeException e) {
            io.rollback(h);
            if (e instanceof IOException ioe) throw ioe;
            throw new IOException("Failed to save engine snapshot: " + snapshotFile, e);
        }
    }

    /**
     * @return the stored snapshot, or empty if none was saved yet
     * @throws IOException if the file exists but is unreadable or invalid
     */
    public Optional<EngineSnapshot> load() throws IOException {
        Optional<String> json = io.readStringIfExists(snapshotFile);
        if (json.isEmpty() || json.get().isBlank()) return Optional.empty();

        EngineSnapshot s = mapper.readValue(json.get(), EngineSnapshot.class);
        try {
            s.validate();
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid engine snapshot " + snapshotFile + ": " + e.getMessage(), e);
        }
        return Optional.of(s);
    }

    public Path file() {
        return snapshotFile;
    }
}
