package org.calista.r3.axiom;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * One inference of a proof: the cited axiom, the transformation applied, a narrative result and the
 * local certainty.
 */
public final class ProofStep {

    public final String axiom;
    public final String transformation;
    public final String result;
    public final double certainty;

    public ProofStep(String axiom, String transformation, String result, double certainty) {
        this.axiom = Objects.requireNonNull(axiom, "axiom");
        this.transformation = Objects.requireNonNull(transformation, "transformation");
        this.result = result == null ? "" : result;
        this.certainty = clamp01(certainty);
    }

    @JsonIgnore
    public boolean isValid() {
        return Axioms.isAllowed(axiom, transformation);
    }

    private static double clamp01(double v) {
        if (!Double.isFinite(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProofStep)) return false;
        ProofStep that = (ProofStep) o;
        return Double.compare(certainty, that.certainty) == 0
                && axiom.equals(that.axiom)
                && transformation.equals(that.transformation)
                && result.equals(that.result);
    }

    @Override
    public int hashCode() {
        return Objects.hash(axiom, transformation, result, certainty);
    }

    @Override
    public String toString() {
        return axiom + ":" + transformation + " -> " + result + " (" + certainty + ")";
    }
}
