package org.calista.r3.reflect;

import java.util.Objects;

public final class ReflectionOutcome {

    public final ReflectionCycle cycle;
    public final CycleMetrics metrics;

    public ReflectionOutcome(ReflectionCycle cycle, CycleMetrics metrics) {
        this.cycle = Objects.requireNonNull(cycle, "cycle");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }
}
