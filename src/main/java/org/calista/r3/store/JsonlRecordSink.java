package org.calista.r3.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.calista.r3.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * JSONL record sink: one {@code {"id", "storedAtEpochMs", "record"}} object per line.
 *
 * <p>Reading skips rows that do not parse; one broken row never fails the whole read.</p>
 */
public final class JsonlRecordSink implements RecordSink {

    private static final Logger log = LoggerFactory.getLogger(JsonlRecordSink.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;
    private final LongSupplier clock;
    private final AtomicLong appended = new AtomicLong();

    public JsonlRecordSink(FileIO io, ObjectMapper mapper, Path file, LongSupplier clock) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.file = Objects.requireNonNull(file, "file");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public synchronized void append(String id, Object record) throws IOException {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("record id must not be blank");
        Objects.requireNonNull(record, "record");

        ObjectNode row = mapper.createObjectNode();
        row.put("id", id);
        row.put("storedAtEpochMs", clock.getAsLong());
        row.set("record", mapper.valueToTree(record));

        io.appendJsonl(file, mapper.writeValueAsString(row));
        appended.incrementAndGet();
    }

    @Override
    public long appended() {
        return appended.get();
    }

    /** All stored rows in file order. */
    public List<JsonNode> readAll() throws IOException {
        List<String> lines = io.readJsonl(file);
        ArrayList<JsonNode> out = new ArrayList<>(lines.size());
        int lineNo = 0;
        for (String line : lines) {
            lineNo++;
            try {
                out.add(mapper.readTree(line));
            } catch (IOException rowErr) {
                log.warn("Skip broken record row {} in {}: {}", lineNo, file, rowErr.getMessage());
            }
        }
        return out;
    }

    public Path file() {
        return file;
    }
}
