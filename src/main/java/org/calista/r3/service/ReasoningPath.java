package org.calista.r3.service;

import org.calista.r3.axiom.GroundedStatement;
import org.calista.r3.reason.ReasoningResult;
import org.calista.r3.reflect.ReflectionCycle;
import org.calista.r3.state.ConvergenceReport;
import org.calista.r3.util.Hashing;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The finalized record of one processed query, handed to the record sink.
 */
public final class ReasoningPath {

    public final String id;
    public final String query;
    public final GroundedStatement grounded;
    public final ReasoningResult reasoning;
    public final ReflectionCycle cycle;
    public final double groundingCertainty;
    public final double emergence;
    public final double lambdaImpact;
    public final int reasoningDepth;
    public final SafetyChecks safety;
    public final ConvergenceReport convergence;
    /** Digest of the query and the grounding, reasoning and cycle hashes. */
    public final String hash;
    public final long timestampEpochMs;

    public ReasoningPath(String id,
                         String query,
                         GroundedStatement grounded,
                         ReasoningResult reasoning,
                         ReflectionCycle cycle,
                         double lambdaImpact,
                         SafetyChecks safety,
                         ConvergenceReport convergence,
                         long timestampEpochMs) {
        this.id = Objects.requireNonNull(id, "id");
        this.query = Objects.requireNonNull(query, "query");
        this.grounded = Objects.requireNonNull(grounded, "grounded");
        this.reasoning = Objects.requireNonNull(reasoning, "reasoning");
        this.cycle = Objects.requireNonNull(cycle, "cycle");
        this.groundingCertainty = grounded.certainty;
        this.emergence = cycle.emergence;
        this.lambdaImpact = lambdaImpact;
        this.reasoningDepth = reasoning.depthUsed;
        this.safety = Objects.requireNonNull(safety, "safety");
        this.convergence = Objects.requireNonNull(convergence, "convergence");
        this.timestampEpochMs = timestampEpochMs;

        Map<String, Object> content = new LinkedHashMap<>(4);
        content.put("query", query);
        content.put("grounded", grounded.hash);
        content.put("reasoning", reasoning.hash);
        content.put("cycle", cycle.hash);
        this.hash = Hashing.digest(content);
    }
}
