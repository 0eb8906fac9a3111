package org.calista.r3.core;

import org.calista.r3.state.ConvergenceReport;
import org.calista.r3.state.EngineMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class R3EngineTest {

    private R3Engine engine;

    @BeforeEach
    void setUp() {
        engine = new R3Composer().clock(() -> 1_700_000_000_000L).buildEngine(new R3Config());
    }

    @Test
    void getMetrics_shouldReflectFreshEngine() {
        EngineMetrics m = engine.getMetrics();

        assertThat(m.lambdaTotal).isEqualTo(10.0);
        assertThat(m.cyclesCompleted).isZero();
        assertThat(m.cacheHitRate).isZero();
        assertThat(m.convergence.confidence).isZero();
    }

    @Test
    void getMetrics_shouldAggregateAcrossOperations() {
        // Act
        engine.ground("A = A", Map.of());
        engine.reasonAbout("John is a teacher", Map.of(), 3);
        engine.reasonAbout("John is a teacher", Map.of(), 3);
        engine.reflect("hello world", Map.of());

        // Assert
        EngineMetrics m = engine.getMetrics();
        assertThat(m.cyclesCompleted).isEqualTo(1);
        assertThat(m.lambdaTotal).isGreaterThan(10.0);
        assertThat(m.avgGroundingCertainty).isEqualTo(1.0);
        assertThat(m.cacheHitRate).isGreaterThan(0.0).isLessThanOrEqualTo(1.0);
        assertThat(m.improvementsApplied).isEqualTo(3);
        assertThat(m.improvementFailures).isZero();
    }

    @Test
    void convergence_shouldRunOverLambdaHistory() {
        for (int i = 0; i < 4; i++) engine.reflect("hello world", Map.of());

        ConvergenceReport r = engine.convergence();

        assertThat(r.samples).isEqualTo(5);
        assertThat(r.confidence).isBetween(0.0, 1.0);
        assertThat(r.trend).isPositive();
    }
}
