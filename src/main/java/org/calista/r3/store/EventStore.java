package org.calista.r3.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.r3.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class EventStore {

    private static final Logger log = LoggerFactory.getLogger(EventStore.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;

    public EventStore(FileIO io, ObjectMapper mapper, Path file) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.file = Objects.requireNonNull(file, "file");
    }

    public void append(R3Event e) throws IOException {
        String line = mapper.writeValueAsString(e);
        io.appendJsonl(file, line);
    }

    public List<String> readAllRawLines() throws IOException {
        return io.readJsonl(file);
    }

    /** Parsed events; rows that do not parse are skipped. */
    public List<R3Event> readAll() throws IOException {
        List<String> lines = io.readJsonl(file);
        ArrayList<R3Event> out = new ArrayList<>(lines.size());
        for (String line : lines) {
            try {
                out.add(mapper.readValue(line, R3Event.class));
            } catch (IOException rowErr) {
                log.warn("Skip broken event row in {}: {}", file, rowErr.getMessage());
            }
        }
        return out;
    }
}
