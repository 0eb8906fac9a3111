package org.calista.r3.reflect;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Tunable baselines the improvement handlers adjust between cycles.
 *
 * <p>Mutable; guarded by the engine state lock. Jackson-bound so it survives snapshots.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ReflectionBaselines {

    public int reasoningDepth = 2;
    public double certaintyThreshold = 0.7;
    public double emergenceTarget = 2.0;
    public double lambdaGrowthTarget = 0.1;
    /** Bonus added to the recursive level's certainty. */
    public double certaintyCalibration = 0.0;
    /** Pattern types no longer flagged as inefficient. */
    public Set<String> optimizedPatterns = new LinkedHashSet<>();

    public ReflectionBaselines() {}

    /**
     * Normalizes out-of-range values to the defaults, the way the config's reflection section is
     * normalized. Applied to baselines read back from a snapshot.
     */
    public void validate() {
        if (reasoningDepth < 1) reasoningDepth = 1;
        if (reasoningDepth > ImprovementHandlers.MAX_REASONING_DEPTH) reasoningDepth = ImprovementHandlers.MAX_REASONING_DEPTH;
        if (!Double.isFinite(certaintyThreshold) || certaintyThreshold < 0.0 || certaintyThreshold > 1.0)
            certaintyThreshold = 0.7;
        if (!(emergenceTarget > 0.0) || !Double.isFinite(emergenceTarget)) emergenceTarget = 2.0;
        if (!(lambdaGrowthTarget > 0.0) || !Double.isFinite(lambdaGrowthTarget)) lambdaGrowthTarget = 0.1;
        if (!Double.isFinite(certaintyCalibration) || certaintyCalibration < 0.0) certaintyCalibration = 0.0;
        if (certaintyCalibration > ImprovementHandlers.MAX_CALIBRATION) certaintyCalibration = ImprovementHandlers.MAX_CALIBRATION;
        if (optimizedPatterns == null) optimizedPatterns = new LinkedHashSet<>();
    }

    public ReflectionBaselines copy() {
        ReflectionBaselines c = new ReflectionBaselines();
        c.reasoningDepth = reasoningDepth;
        c.certaintyThreshold = certaintyThreshold;
        c.emergenceTarget = emergenceTarget;
        c.lambdaGrowthTarget = lambdaGrowthTarget;
        c.certaintyCalibration = certaintyCalibration;
        c.optimizedPatterns = new LinkedHashSet<>(optimizedPatterns == null ? Set.of() : optimizedPatterns);
        return c;
    }

    @Override
    public String toString() {
        return "ReflectionBaselines{depth=" + reasoningDepth
                + ", threshold=" + certaintyThreshold
                + ", calibration=" + certaintyCalibration
                + ", optimized=" + optimizedPatterns
                + '}';
    }
}
