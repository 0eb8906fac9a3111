package org.calista.r3.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.r3.io.FileIO;
import org.calista.r3.state.ConvergenceDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * R3Config — plain POJO config:
 * - defaults in fields
 * - loadOrCreate() writes the defaults if the file is missing
 * - validate() normalizes values
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class R3Config {

    private static final Logger log = LoggerFactory.getLogger(R3Config.class);

    public String baseDir = "data";
    public Records records = new Records();
    public Events events = new Events();
    public State state = new State();
    public Reasoning reasoning = new Reasoning();
    public Reflection reflection = new Reflection();
    public Convergence convergence = new Convergence();
    public Requests requests = new Requests();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Records {
        public String file = "reasoning-paths.jsonl";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Events {
        public String logFile = "events.jsonl";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class State {
        public String snapshotFile = "engine-state.json";
        public int autoSnapshotEveryQueries = 5;
        /** Restore the last snapshot when the kernel starts. */
        public boolean resume = false;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Reasoning {
        public int maxDepth = 10;
        /** 0 => unbounded */
        public int cacheCapacity = 0;
        /** One-hop implications explored per refinement pass. */
        public int maxImplications = 8;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Reflection {
        public double initialLambda = 10.0;
        public int reasoningDepth = 2;
        public double certaintyThreshold = 0.7;
        public double emergenceTarget = 2.0;
        public double lambdaGrowthTarget = 0.1;
        public int emergenceWindow = 5;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Convergence {
        public int window = 5;
        public int minSamples = 3;
        public double avgChangeThreshold = 0.01;
        public double stdChangeThreshold = 0.02;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Requests {
        public int maxQueryChars = 4096;
    }

    // -------------------- Load / Create --------------------

    /**
     * Loads the config. A missing (or empty) file is created with defaults.
     */
    public static R3Config loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            R3Config created = new R3Config();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            R3Config created = new R3Config();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        R3Config cfg = mapper.readValue(json, R3Config.class);
        if (cfg == null) cfg = new R3Config();

        cfg.validate();
        return cfg;
    }

    public static void save(FileIO io, Path configFile, ObjectMapper mapper, R3Config cfg) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, R3Config cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = "data";

        if (records == null) records = new Records();
        if (records.file == null || records.file.isBlank()) records.file = "reasoning-paths.jsonl";

        if (events == null) events = new Events();
        if (events.logFile == null || events.logFile.isBlank()) events.logFile = "events.jsonl";

        if (state == null) state = new State();
        if (state.snapshotFile == null || state.snapshotFile.isBlank()) state.snapshotFile = "engine-state.json";
        if (state.autoSnapshotEveryQueries < 1) state.autoSnapshotEveryQueries = 1;

        if (reasoning == null) reasoning = new Reasoning();
        if (reasoning.maxDepth < 1) reasoning.maxDepth = 1;
        if (reasoning.maxDepth > 32) reasoning.maxDepth = 32;
        if (reasoning.cacheCapacity < 0) reasoning.cacheCapacity = 0;
        if (reasoning.maxImplications < 0) reasoning.maxImplications = 0;

        if (reflection == null) reflection = new Reflection();
        if (!Double.isFinite(reflection.initialLambda) || reflection.initialLambda < 0.0) reflection.initialLambda = 10.0;
        if (reflection.reasoningDepth < 1) reflection.reasoningDepth = 1;
        if (reflection.reasoningDepth > 10) reflection.reasoningDepth = 10;
        if (!Double.isFinite(reflection.certaintyThreshold)
                || reflection.certaintyThreshold < 0.0 || reflection.certaintyThreshold > 1.0)
            reflection.certaintyThreshold = 0.7;
        if (!(reflection.emergenceTarget > 0.0) || !Double.isFinite(reflection.emergenceTarget))
            reflection.emergenceTarget = 2.0;
        if (!(reflection.lambdaGrowthTarget > 0.0) || !Double.isFinite(reflection.lambdaGrowthTarget))
            reflection.lambdaGrowthTarget = 0.1;
        if (reflection.emergenceWindow < 1) reflection.emergenceWindow = 5;

        if (convergence == null) convergence = new Convergence();
        if (convergence.window < 2) convergence.window = 2;
        if (convergence.minSamples < ConvergenceDetector.MIN_SAMPLES) convergence.minSamples = ConvergenceDetector.MIN_SAMPLES;
        if (!(convergence.avgChangeThreshold > 0.0)) convergence.avgChangeThreshold = 0.01;
        if (!(convergence.stdChangeThreshold > 0.0)) convergence.stdChangeThreshold = 0.02;

        if (requests == null) requests = new Requests();
        if (requests.maxQueryChars < 1) requests.maxQueryChars = 4096;
    }
}
