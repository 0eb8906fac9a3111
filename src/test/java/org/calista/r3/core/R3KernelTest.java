package org.calista.r3.core;

import org.calista.r3.store.JsonlRecordSink;
import org.calista.r3.store.RecordSink;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class R3KernelTest {

    @TempDir
    Path dir;

    @Test
    void build_shouldCreateConfigAndBindStoresUnderBaseDir() throws IOException {
        R3Kernel k = R3Kernel.builder().configRoot(dir).build(Path.of("config/config.json"));

        assertThat(Files.exists(dir.resolve("config/config.json"))).isTrue();
        assertThat(k.io().baseDir()).isEqualTo(dir.resolve("data").toAbsolutePath().normalize());
        assertThat(Files.isDirectory(k.io().baseDir())).isTrue();
        assertThat(k.recordSink()).isInstanceOf(JsonlRecordSink.class);
        assertThat(((JsonlRecordSink) k.recordSink()).file().getFileName().toString()).isEqualTo("reasoning-paths.jsonl");
        assertThat(k.snapshotStore().file().startsWith(k.io().baseDir())).isTrue();
        assertThat(k.config().state.snapshotFile).isEqualTo("engine-state.json");
    }

    @Test
    void build_shouldUseInjectedRecordSink() throws IOException {
        RecordSink sink = mock(RecordSink.class);

        R3Kernel k = R3Kernel.builder().configRoot(dir).recordSink(sink).build(Path.of("config.json"));

        assertThat(k.recordSink()).isSameAs(sink);
    }
}
