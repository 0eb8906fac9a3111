package org.calista.r3.reason;

import java.util.List;

/**
 * Output of the non-recursive reasoning step.
 */
public final class BaseReasoning {

    public final List<Inference> directInferences;
    public final List<String> contradictions;
    public final List<String> unknowns;
    /** Entities present in the concept graph, in query order. */
    public final List<String> knownEntities;
    public final List<PatternMatch> patterns;
    public final boolean needsRefinement;

    public BaseReasoning(List<Inference> directInferences,
                         List<String> contradictions,
                         List<String> unknowns,
                         List<String> knownEntities,
                         List<PatternMatch> patterns) {
        this.directInferences = directInferences == null ? List.of() : List.copyOf(directInferences);
        this.contradictions = contradictions == null ? List.of() : List.copyOf(contradictions);
        this.unknowns = unknowns == null ? List.of() : List.copyOf(unknowns);
        this.knownEntities = knownEntities == null ? List.of() : List.copyOf(knownEntities);
        this.patterns = patterns == null ? List.of() : List.copyOf(patterns);
        this.needsRefinement = !this.unknowns.isEmpty()
                || !this.contradictions.isEmpty()
                || this.patterns.isEmpty();
    }
}
