package org.calista.r3.core;

import org.calista.r3.reason.ConceptGraph;
import org.calista.r3.reflect.ReflectionBaselines;
import org.calista.r3.state.EngineState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class R3ComposerTest {

    @TempDir
    Path dir;

    @Test
    void buildEngine_shouldCopyConfigIntoState() {
        R3Config cfg = new R3Config();
        cfg.reflection.initialLambda = 3.0;
        cfg.reflection.reasoningDepth = 4;
        cfg.reasoning.cacheCapacity = 16;

        R3Engine engine = new R3Composer().clock(() -> 0L).buildEngine(cfg);

        assertThat(engine.state().lambdaTotal()).isEqualTo(3.0);
        assertThat(engine.state().baselines().reasoningDepth).isEqualTo(4);
        assertThat(engine.state().cacheCapacity()).isEqualTo(16);
        assertThat(engine.graph().size()).isEqualTo(ConceptGraph.LOGICAL_OPERATORS.size());
    }

    @Test
    void buildEngine_shouldUseProvidedGraph() {
        ConceptGraph g = new ConceptGraph();
        g.addConcept("Socrates");

        R3Engine engine = new R3Composer().graph(g).buildEngine(new R3Config());

        assertThat(engine.graph()).isSameAs(g);
        assertThat(engine.reasonAbout("Socrates thinks", Map.of(), 1).unknowns()).isEmpty();
    }

    @Test
    void buildEngine_shouldRestoreSnapshotWhenResumeIsSet() throws IOException {
        // Arrange
        R3Kernel first = R3Kernel.builder().configRoot(dir).build(Path.of("config.json"));
        EngineState previous = new EngineState(42.0, new ReflectionBaselines(), 0);
        first.snapshotStore().save(previous.snapshot(1L));

        R3Config cfg = first.config();
        cfg.state.resume = true;
        R3Config.save(first.io(), dir.resolve("config.json"), first.mapper(), cfg);

        // Act
        R3Kernel second = R3Kernel.builder().configRoot(dir).build(Path.of("config.json"));
        R3Engine engine = new R3Composer().buildEngine(second);

        // Assert
        assertThat(engine.state().lambdaTotal()).isEqualTo(42.0);
    }

    @Test
    void buildEngine_shouldStartFreshWithoutResume() throws IOException {
        R3Kernel first = R3Kernel.builder().configRoot(dir).build(Path.of("config.json"));
        first.snapshotStore().save(new EngineState(42.0, new ReflectionBaselines(), 0).snapshot(1L));

        R3Engine engine = new R3Composer().buildEngine(first);

        assertThat(engine.state().lambdaTotal()).isEqualTo(10.0);
    }
}
