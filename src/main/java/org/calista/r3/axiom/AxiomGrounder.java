package org.calista.r3.axiom;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.r3.text.ContradictionMarkers;
import org.calista.r3.text.WhitespaceTokenizer;

import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.function.LongSupplier;

/**
 * AxiomGrounder — attaches a deterministic proof and certainty to any statement.
 *
 * <p>Contract: {@link #ground(String, Map)} never throws for domain reasons. A proof that fails
 * verification is replaced by the minimal grounding (one A1 step, certainty 0.1).</p>
 *
 * <p>Thread-safety: proof construction is pure; the bookkeeping (history, proof cache) is synchronized.</p>
 */
public final class AxiomGrounder {

    private static final Logger log = LogManager.getLogger(AxiomGrounder.class);

    public static final double FALLBACK_CERTAINTY = 0.1;
    public static final int HISTORY_CAPACITY = 1000;

    private final LongSupplier clock;

    // bookkeeping (never feeds back into proofs)
    private final ArrayDeque<Double> certaintyHistory = new ArrayDeque<>(64);
    private final Map<String, GroundedStatement> proofCache;
    private long totalGrounded;
    private long fallbacks;

    public AxiomGrounder() {
        this(System::currentTimeMillis);
    }

    public AxiomGrounder(LongSupplier clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.proofCache = new LinkedHashMap<>(256, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, GroundedStatement> eldest) {
                return size() > HISTORY_CAPACITY;
            }
        };
    }

    // ---------------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------------

    /**
     * Grounds a statement in the axiom table.
     *
     * @param statement non-empty statement text
     * @param context   caller context; informational only, proofs do not depend on it
     */
    public GroundedStatement ground(String statement, Map<String, ?> context) {
        final String s = (statement == null ? "" : statement);
        List<ProofStep> steps = generateProof(s);
        GroundedStatement g = finish(s, steps);
        log.debug("ground: steps={} certainty={} fallback={} ctxKeys={}",
                g.steps.size(), g.certainty, g.fallback, (context == null ? 0 : context.size()));
        return g;
    }

    /**
     * Grounds a statement with a caller-supplied proof. The proof is verified like a generated one.
     */
    public GroundedStatement groundWithProof(String statement, List<ProofStep> steps) {
        final String s = (statement == null ? "" : statement);
        return finish(s, (steps == null ? List.of() : steps));
    }

    /** True if a grounding with this hash was produced recently (bounded proof cache). */
    public synchronized boolean isKnownProof(String hash) {
        return hash != null && proofCache.containsKey(hash);
    }

    public synchronized Stats stats() {
        double mean = 0.0;
        double std = 0.0;
        int n = certaintyHistory.size();
        if (n > 0) {
            double sum = 0.0;
            for (double c : certaintyHistory) sum += c;
            mean = sum / n;
            if (n > 1) {
                double sq = 0.0;
                for (double c : certaintyHistory) sq += (c - mean) * (c - mean);
                std = Math.sqrt(sq / n);
            }
        }
        return new Stats(totalGrounded, fallbacks, mean, std, proofCache.size(), Axioms.size());
    }

    // ---------------------------------------------------------------------
    // Proof construction
    // ---------------------------------------------------------------------

    List<ProofStep> generateProof(String statement) {
        ArrayList<ProofStep> steps = new ArrayList<>(6);

        steps.add(new ProofStep(Axioms.EXISTENCE, "existential",
                "'" + statement + "' exists as conscious content", 1.0));

        steps.add(new ProofStep(Axioms.IDENTITY, "identity",
                "Statement is self-identical", 1.0));

        if (ContradictionMarkers.inStatement(statement)) {
            steps.add(new ProofStep(Axioms.NON_CONTRADICTION, "contradiction_elimination",
                    "Contradiction resolved via law of non-contradiction", 1.0));
        }

        steps.add(new ProofStep(Axioms.EXCLUDED_MIDDLE, "disjunction",
                "Statement or its negation holds", 1.0));

        int bytes = statement.getBytes(StandardCharsets.UTF_8).length;
        steps.add(new ProofStep(Axioms.CONSERVATION, "conservation",
                "Information conserved (" + bytes + " bytes)", 0.99));

        double potential = WhitespaceTokenizer.wordCount(statement) / 10.0;
        steps.add(new ProofStep(Axioms.EMERGENCE, "emergence_potential",
                String.format(Locale.ROOT, "Emergence potential: %.2f", potential), 0.95));

        return steps;
    }

    /**
     * Aggregate certainty: product of step certainties (independence) + depth bonus + consistency bonus,
     * clamped to [0,1], with a 0.85 floor for strong proofs of four or more steps.
     */
    public static double certaintyOf(List<ProofStep> steps) {
        if (steps == null || steps.isEmpty()) return 0.0;

        double product = 1.0;
        HashSet<String> axioms = new HashSet<>();
        for (ProofStep s : steps) {
            product *= s.certainty;
            axioms.add(s.axiom);
        }

        double depthBonus = Math.min(0.3, 0.05 * steps.size());
        double consistencyBonus = ((double) axioms.size() / Axioms.size()) * 0.1;

        double total = Math.max(0.0, Math.min(1.0, product + depthBonus + consistencyBonus));
        if (total > 0.8 && steps.size() >= 4) total = Math.max(total, 0.85);
        return total;
    }

    private GroundedStatement finish(String statement, List<ProofStep> steps) {
        final long now = clock.getAsLong();
        GroundedStatement g;
        if (GroundedStatement.verify(steps)) {
            g = new GroundedStatement(statement, steps, certaintyOf(steps), false, now);
        } else {
            log.warn("ground: proof failed verification, using minimal grounding (steps={})", steps.size());
            g = minimal(statement, now);
        }
        record(g);
        return g;
    }

    static GroundedStatement minimal(String statement, long timestampEpochMs) {
        ProofStep only = new ProofStep(Axioms.EXISTENCE, "existential", "unproven", FALLBACK_CERTAINTY);
        return new GroundedStatement(statement, List.of(only), FALLBACK_CERTAINTY, true, timestampEpochMs);
    }

    private synchronized void record(GroundedStatement g) {
        totalGrounded++;
        if (g.fallback) fallbacks++;
        certaintyHistory.addLast(g.certainty);
        while (certaintyHistory.size() > HISTORY_CAPACITY) certaintyHistory.removeFirst();
        proofCache.put(g.hash, g);
    }

    // ---------------------------------------------------------------------
    // DTO
    // ---------------------------------------------------------------------

    public static final class Stats {
        public final long totalGrounded;
        public final long fallbacks;
        /** Mean certainty over the rolling history. */
        public final double avgCertainty;
        /** Population standard deviation over the rolling history. */
        public final double stdCertainty;
        public final int proofCacheSize;
        public final int axiomsLoaded;

        public Stats(long totalGrounded, long fallbacks, double avgCertainty, double stdCertainty,
                     int proofCacheSize, int axiomsLoaded) {
            this.totalGrounded = totalGrounded;
            this.fallbacks = fallbacks;
            this.avgCertainty = avgCertainty;
            this.stdCertainty = stdCertainty;
            this.proofCacheSize = proofCacheSize;
            this.axiomsLoaded = axiomsLoaded;
        }
    }
}
