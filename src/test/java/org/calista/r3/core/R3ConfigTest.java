package org.calista.r3.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.r3.io.FileIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class R3ConfigTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void loadOrCreate_shouldWriteDefaultsWhenFileMissing() throws IOException {
        FileIO io = new FileIO(dir);
        Path file = dir.resolve("config/config.json");

        R3Config cfg = R3Config.loadOrCreate(io, file, mapper);

        assertThat(Files.exists(file)).isTrue();
        assertThat(cfg.baseDir).isEqualTo("data");
        assertThat(cfg.reasoning.maxDepth).isEqualTo(10);
        assertThat(cfg.reflection.initialLambda).isEqualTo(10.0);
        assertThat(cfg.state.resume).isFalse();
        assertThat(mapper.readTree(file.toFile()).get("reflection").get("emergenceTarget").asDouble()).isEqualTo(2.0);
    }

    @Test
    void loadOrCreate_shouldReadPartialConfigAndIgnoreUnknownFields() throws IOException {
        FileIO io = new FileIO(dir);
        Path file = dir.resolve("config.json");
        io.writeString(file, "{\"baseDir\":\"runtime\",\"reasoning\":{\"maxDepth\":4},\"legacy\":{\"x\":1}}");

        R3Config cfg = R3Config.loadOrCreate(io, file, mapper);

        assertThat(cfg.baseDir).isEqualTo("runtime");
        assertThat(cfg.reasoning.maxDepth).isEqualTo(4);
        assertThat(cfg.reasoning.maxImplications).isEqualTo(8);
        assertThat(cfg.requests.maxQueryChars).isEqualTo(4096);
    }

    @Test
    void loadOrCreate_shouldRecreateDefaultsForBlankFile() throws IOException {
        FileIO io = new FileIO(dir);
        Path file = dir.resolve("config.json");
        io.writeString(file, "   ");

        R3Config cfg = R3Config.loadOrCreate(io, file, mapper);

        assertThat(cfg.records.file).isEqualTo("reasoning-paths.jsonl");
        assertThat(io.readString(file)).contains("\"records\"");
    }

    @Test
    void validate_shouldNormalizeOutOfRangeValues() {
        R3Config cfg = new R3Config();
        cfg.baseDir = " ";
        cfg.reasoning.maxDepth = 100;
        cfg.reasoning.cacheCapacity = -5;
        cfg.reflection.reasoningDepth = 0;
        cfg.reflection.certaintyThreshold = 1.5;
        cfg.reflection.initialLambda = Double.NaN;
        cfg.convergence = null;
        cfg.state.autoSnapshotEveryQueries = 0;

        cfg.validate();

        assertThat(cfg.baseDir).isEqualTo("data");
        assertThat(cfg.reasoning.maxDepth).isEqualTo(32);
        assertThat(cfg.reasoning.cacheCapacity).isZero();
        assertThat(cfg.reflection.reasoningDepth).isEqualTo(1);
        assertThat(cfg.reflection.certaintyThreshold).isEqualTo(0.7);
        assertThat(cfg.reflection.initialLambda).isEqualTo(10.0);
        assertThat(cfg.convergence.minSamples).isEqualTo(3);
        assertThat(cfg.state.autoSnapshotEveryQueries).isEqualTo(1);
    }

    @Test
    void validate_shouldRaiseConvergenceMinSamplesToThree() {
        R3Config cfg = new R3Config();
        cfg.convergence.minSamples = 2;

        cfg.validate();

        assertThat(cfg.convergence.minSamples).isEqualTo(3);
    }
}
