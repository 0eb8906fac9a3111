package org.calista.r3.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.r3.io.FileIO;
import org.calista.r3.store.EventStore;
import org.calista.r3.store.JsonlRecordSink;
import org.calista.r3.store.RecordSink;
import org.calista.r3.store.StateSnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * R3Kernel — instance-owned runtime container.
 *
 * Lifecycle:
 *   1) build(config)  -> loadOrCreate config + init IO and stores
 *   2) use            -> compose an engine, run the service
 *
 * No static singletons: lifecycle is explicit.
 */
public final class R3Kernel {

    private static final Logger log = LoggerFactory.getLogger(R3Kernel.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final R3Config cfg;

    private final EventStore events;
    private final StateSnapshotStore snapshots;
    private final RecordSink records;

    private R3Kernel(FileIO io,
                     ObjectMapper mapper,
                     R3Config cfg,
                     EventStore events,
                     StateSnapshotStore snapshots,
                     RecordSink records) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.events = Objects.requireNonNull(events, "events");
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
        this.records = Objects.requireNonNull(records, "records");
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;

        /**
         * Root directory where config lives.
         * Config is read BEFORE baseDir is known (baseDir is inside config).
         */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;
        private RecordSink recordSink;
        private LongSupplier clock = System::currentTimeMillis;

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        /** Replaces the JSONL record sink. */
        public Builder recordSink(RecordSink recordSink) {
            this.recordSink = Objects.requireNonNull(recordSink, "recordSink");
            return this;
        }

        public Builder clock(LongSupplier clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Creates the container: loads/creates config, initializes IO and stores.
         */
        public R3Kernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();

            // config IO (outside baseDir)
            FileIO external = new FileIO(configRoot, charset, true);
            Path cfgPath = configFile.isAbsolute() ? configFile : configRoot.resolve(configFile);

            R3Config cfg = R3Config.loadOrCreate(external, cfgPath, om);

            // runtime IO bound to cfg.baseDir, relative to configRoot
            Path base = Path.of(cfg.baseDir);
            FileIO io = new FileIO(base.isAbsolute() ? base : configRoot.resolve(base), charset, true);
            io.ensureBaseDir();

            EventStore events = new EventStore(io, om, io.resolve(cfg.events.logFile));
            StateSnapshotStore snapshots = new StateSnapshotStore(io, om, io.resolve(cfg.state.snapshotFile));
            RecordSink records = (recordSink != null)
                    ? recordSink
                    : new JsonlRecordSink(io, om, io.resolve(cfg.records.file), clock);

            R3Kernel k = new R3Kernel(io, om, cfg, events, snapshots, records);
            k.logCreated(cfgPath);
            return k;
        }

        private static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public ObjectMapper mapper() { return mapper; }
    public R3Config config() { return cfg; }
    public EventStore eventStore() { return events; }
    public StateSnapshotStore snapshotStore() { return snapshots; }
    public RecordSink recordSink() { return records; }

    private void logCreated(Path cfgPath) {
        if (!log.isInfoEnabled()) return;
        log.info("R3Kernel created: config={}, baseDir={}, records={}",
                cfgPath, io.baseDir(), cfg.records.file);
    }
}
