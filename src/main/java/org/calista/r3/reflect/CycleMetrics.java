package org.calista.r3.reflect;

/**
 * Metrics snapshot returned with every reflection cycle.
 */
public final class CycleMetrics {

    public final double lambdaTotal;
    public final double lambdaGrowth;
    public final double emergence;
    /** Number of the level the cycle reached (1..4). */
    public final int refinementLevel;
    public final int improvementsGenerated;
    public final double durationMs;

    public CycleMetrics(double lambdaTotal, double lambdaGrowth, double emergence,
                        int refinementLevel, int improvementsGenerated, double durationMs) {
        this.lambdaTotal = lambdaTotal;
        this.lambdaGrowth = lambdaGrowth;
        this.emergence = emergence;
        this.refinementLevel = refinementLevel;
        this.improvementsGenerated = improvementsGenerated;
        this.durationMs = durationMs;
    }
}
