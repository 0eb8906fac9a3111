package org.calista.r3.reflect;

import java.util.List;
import java.util.Objects;

/**
 * Record synthesized by a transcendent breakthrough.
 */
public final class Framework {

    public final String name;
    /** Improvement kinds of the cycle that produced it. */
    public final List<String> basis;
    public final double avgEmergence;
    public final double potentialGain;
    public final int cycleIndex;

    public Framework(String name, List<String> basis, double avgEmergence, double potentialGain, int cycleIndex) {
        this.name = Objects.requireNonNull(name, "name");
        this.basis = basis == null ? List.of() : List.copyOf(basis);
        this.avgEmergence = avgEmergence;
        this.potentialGain = potentialGain;
        this.cycleIndex = cycleIndex;
    }
}
