package org.calista.r3.reason;

import org.calista.r3.util.Hashing;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of {@link ReasoningEngine#reasonAbout}. Immutable.
 *
 * <p>{@link #hash} is computed from every field except {@link #timestampEpochMs}.</p>
 */
public final class ReasoningResult {

    public final String query;
    public final Components components;
    public final BaseReasoning base;
    /** First refinement pass, or null when refinement was not needed or no budget remained. */
    public final RefinementPass refinement;
    /** Refinements with distinct content, across all passes. */
    public final List<Refinement> novelInsights;
    public final double certainty;
    public final double emergence;
    public final int depthUsed;
    public final String hash;
    public final long timestampEpochMs;

    public ReasoningResult(String query,
                           Components components,
                           BaseReasoning base,
                           RefinementPass refinement,
                           List<Refinement> novelInsights,
                           double certainty,
                           double emergence,
                           int depthUsed,
                           long timestampEpochMs) {
        this.query = Objects.requireNonNull(query, "query");
        this.components = Objects.requireNonNull(components, "components");
        this.base = Objects.requireNonNull(base, "base");
        this.refinement = refinement;
        this.novelInsights = novelInsights == null ? List.of() : List.copyOf(novelInsights);
        this.certainty = certainty;
        this.emergence = emergence;
        this.depthUsed = depthUsed;
        this.timestampEpochMs = timestampEpochMs;
        this.hash = computeHash();
    }

    private String computeHash() {
        Map<String, Object> content = new LinkedHashMap<>(12);
        content.put("query", query);
        content.put("components", components);
        content.put("base", base);
        content.put("refinement", refinement);
        content.put("novelInsights", novelInsights);
        content.put("certainty", certainty);
        content.put("emergence", emergence);
        content.put("depthUsed", depthUsed);
        return Hashing.digest(content);
    }

    public List<String> contradictions() {
        return base.contradictions;
    }

    public List<String> unknowns() {
        return base.unknowns;
    }

    public List<PatternMatch> patterns() {
        return base.patterns;
    }

    public int refinementCount() {
        return refinement == null ? 0 : refinement.allRefinements().size();
    }

    @Override
    public String toString() {
        return "ReasoningResult{depth=" + depthUsed
                + ", certainty=" + certainty
                + ", emergence=" + emergence
                + ", unknowns=" + base.unknowns.size()
                + ", contradictions=" + base.contradictions.size()
                + ", hash=" + hash.substring(0, 12)
                + '}';
    }
}
