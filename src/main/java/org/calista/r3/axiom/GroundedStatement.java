package org.calista.r3.axiom;

import org.calista.r3.util.Hashing;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * A statement together with its proof.
 *
 * <p>The hash covers the statement and the ordered step contents only; it is computed once here and
 * never changes. {@link #timestampEpochMs} is informational and excluded from the hash.</p>
 */
public final class GroundedStatement {

    public final String statement;
    public final List<ProofStep> steps;
    public final double certainty;
    public final String hash;
    /** Distinct axiom ids cited by the proof, sorted. */
    public final List<String> axiomsUsed;
    /** True when the generated proof failed verification and the minimal grounding was substituted. */
    public final boolean fallback;
    public final long timestampEpochMs;

    GroundedStatement(String statement, List<ProofStep> steps, double certainty, boolean fallback, long timestampEpochMs) {
        this.statement = Objects.requireNonNull(statement, "statement");
        this.steps = List.copyOf(Objects.requireNonNull(steps, "steps"));
        this.certainty = certainty;
        this.fallback = fallback;
        this.timestampEpochMs = timestampEpochMs;

        TreeSet<String> used = new TreeSet<>();
        for (ProofStep s : this.steps) used.add(s.axiom);
        this.axiomsUsed = List.copyOf(used);

        this.hash = hashOf(this.statement, this.steps);
    }

    /** Deterministic proof hash over (statement, ordered steps). */
    public static String hashOf(String statement, List<ProofStep> steps) {
        Map<String, Object> content = new LinkedHashMap<>(4);
        content.put("statement", statement);
        content.put("steps", steps);
        return Hashing.digest(content);
    }

    /**
     * Checks every step against its axiom's allowed transformation vocabulary.
     */
    public boolean verifyProof() {
        return verify(steps);
    }

    public static boolean verify(List<ProofStep> steps) {
        if (steps == null || steps.isEmpty()) return false;
        for (ProofStep s : steps) {
            if (s == null || !s.isValid()) return false;
        }
        return true;
    }

    public boolean contains(String axiomId, String transformation) {
        for (ProofStep s : steps) {
            if (s.axiom.equals(axiomId) && s.transformation.equals(transformation)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "GroundedStatement{steps=" + steps.size()
                + ", certainty=" + certainty
                + ", fallback=" + fallback
                + ", hash=" + hash.substring(0, 12)
                + '}';
    }
}
