package org.calista.r3.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.calista.r3.reflect.ReflectionBaselines;

import java.util.ArrayList;
import java.util.List;

/**
 * Persisted form of {@link EngineState}: Λ, numeric histories, cycle count and baselines.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EngineSnapshot {

    public static final String SCHEMA = "r3-state-v1";

    public String schema = SCHEMA;
    public double lambdaTotal;
    public List<Double> lambdaHistory = new ArrayList<>();
    public List<Double> emergenceHistory = new ArrayList<>();
    public int cyclesCompleted;
    public ReflectionBaselines baselines = new ReflectionBaselines();
    public long savedAtEpochMs;

    public EngineSnapshot() {}

    /**
     * Normalizes nulls and baselines, and rejects values that would break Λ monotonicity.
     */
    public void validate() {
        if (schema == null) schema = SCHEMA;
        if (!SCHEMA.equals(schema)) {
            throw new IllegalArgumentException("Unsupported snapshot schema: " + schema);
        }
        if (!Double.isFinite(lambdaTotal) || lambdaTotal < 0.0) {
            throw new IllegalArgumentException("Snapshot lambdaTotal must be finite and >= 0: " + lambdaTotal);
        }
        if (cyclesCompleted < 0) {
            throw new IllegalArgumentException("Snapshot cyclesCompleted must be >= 0: " + cyclesCompleted);
        }
        if (lambdaHistory == null) lambdaHistory = new ArrayList<>();
        if (emergenceHistory == null) emergenceHistory = new ArrayList<>();
        if (baselines == null) baselines = new ReflectionBaselines();
        baselines.validate();
    }
}
