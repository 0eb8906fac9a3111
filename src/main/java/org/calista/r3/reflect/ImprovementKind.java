package org.calista.r3.reflect;

/**
 * Closed set of improvements a regenerative level may propose.
 */
public enum ImprovementKind {

    INCREASE_REASONING_DEPTH("increase_reasoning_depth", 0.15),
    IMPROVE_CERTAINTY("improve_certainty", 0.10),
    OPTIMIZE_PATTERNS("optimize_patterns", 0.20);

    /** Stable identifier used in logs and persisted records. */
    public final String id;
    /** Expected impact weight. */
    public final double impact;

    ImprovementKind(String id, double impact) {
        this.id = id;
        this.impact = impact;
    }
}
