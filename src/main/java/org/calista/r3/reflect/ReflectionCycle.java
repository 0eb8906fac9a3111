package org.calista.r3.reflect;

import org.calista.r3.util.Hashing;

import java.util.List;
import java.util.Objects;

/**
 * One completed reflection cycle. Immutable; appended to the engine state history and never changed.
 */
public final class ReflectionCycle {

    public final String id;
    /** Zero-based position in the cycle history. */
    public final int index;
    public final String query;
    /** Level results in {@link ReflectionLevel#PIPELINE} order. */
    public final List<LevelResult> levels;
    public final ReflectionLevel levelReached;
    public final List<ImprovementProposal> improvements;
    public final double emergence;
    public final double lambdaImpact;
    public final double durationMs;
    public final boolean breakthrough;
    /** Present only on breakthrough. */
    public final Framework framework;
    public final String hash;
    public final long timestampEpochMs;

    public ReflectionCycle(String id,
                           int index,
                           String query,
                           List<LevelResult> levels,
                           ReflectionLevel levelReached,
                           List<ImprovementProposal> improvements,
                           double emergence,
                           double lambdaImpact,
                           double durationMs,
                           boolean breakthrough,
                           Framework framework,
                           long timestampEpochMs) {
        this.id = Objects.requireNonNull(id, "id");
        this.index = index;
        this.query = query == null ? "" : query;
        this.levels = List.copyOf(Objects.requireNonNull(levels, "levels"));
        this.levelReached = Objects.requireNonNull(levelReached, "levelReached");
        this.improvements = improvements == null ? List.of() : List.copyOf(improvements);
        this.emergence = emergence;
        this.lambdaImpact = lambdaImpact;
        this.durationMs = durationMs;
        this.breakthrough = breakthrough;
        this.framework = framework;
        this.timestampEpochMs = timestampEpochMs;
        this.hash = hashOf(this.id, this.levelReached, this.levels.size(), this.improvements.size());
    }

    public static String hashOf(String id, ReflectionLevel reached, int reflections, int improvements) {
        return Hashing.sha256Hex(id + "|" + reached.number + "|" + reflections + "|" + improvements);
    }

    public LevelResult level(ReflectionLevel level) {
        for (LevelResult r : levels) {
            if (r.level == level) return r;
        }
        throw new IllegalArgumentException("Cycle " + id + " has no " + level + " result");
    }

    public int insightCount() {
        int n = 0;
        for (LevelResult r : levels) n += r.insights.size();
        return n;
    }

    @Override
    public String toString() {
        return "ReflectionCycle{id=" + id
                + ", reached=" + levelReached
                + ", emergence=" + emergence
                + ", lambdaImpact=" + lambdaImpact
                + ", breakthrough=" + breakthrough
                + '}';
    }
}
