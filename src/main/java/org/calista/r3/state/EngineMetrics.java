package org.calista.r3.state;

/**
 * Aggregate metrics returned by {@code R3Engine.getMetrics()}.
 */
public final class EngineMetrics {

    /** Mean certainty of computed reasoning results. */
    public final double avgCertainty;
    /** Mean reflection-layer emergence over the cycle history. */
    public final double avgEmergence;
    public final double cacheHitRate;
    public final double lambdaTotal;
    public final ConvergenceReport convergence;
    public final int cyclesCompleted;
    public final int cacheSize;
    public final double avgGroundingCertainty;
    public final long improvementsApplied;
    public final long improvementFailures;

    public EngineMetrics(double avgCertainty,
                         double avgEmergence,
                         double cacheHitRate,
                         double lambdaTotal,
                         ConvergenceReport convergence,
                         int cyclesCompleted,
                         int cacheSize,
                         double avgGroundingCertainty,
                         long improvementsApplied,
                         long improvementFailures) {
        this.avgCertainty = avgCertainty;
        this.avgEmergence = avgEmergence;
        this.cacheHitRate = cacheHitRate;
        this.lambdaTotal = lambdaTotal;
        this.convergence = convergence;
        this.cyclesCompleted = cyclesCompleted;
        this.cacheSize = cacheSize;
        this.avgGroundingCertainty = avgGroundingCertainty;
        this.improvementsApplied = improvementsApplied;
        this.improvementFailures = improvementFailures;
    }
}
