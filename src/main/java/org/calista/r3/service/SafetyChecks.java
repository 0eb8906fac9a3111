package org.calista.r3.service;

import org.calista.r3.axiom.GroundedStatement;
import org.calista.r3.reason.ReasoningResult;

import java.util.List;
import java.util.Locale;

/**
 * The four safety checks run on every reasoning path.
 */
public final class SafetyChecks {

    public static final List<String> HARM_WORDS = List.of("harm", "hurt", "kill", "steal");
    /** Stored paths allowed before the stability check fails. */
    public static final int MAX_STORED_PATHS = 1000;

    /** The grounding proof verifies. */
    public final boolean logicalConsistency;
    public final boolean noContradictions;
    /** The query mentions none of {@link #HARM_WORDS}. */
    public final boolean ethicalAlignment;
    public final boolean systemStability;

    public SafetyChecks(boolean logicalConsistency, boolean noContradictions,
                        boolean ethicalAlignment, boolean systemStability) {
        this.logicalConsistency = logicalConsistency;
        this.noContradictions = noContradictions;
        this.ethicalAlignment = ethicalAlignment;
        this.systemStability = systemStability;
    }

    public static SafetyChecks evaluate(String query, GroundedStatement grounded, ReasoningResult reasoning, int storedPaths) {
        String q = (query == null ? "" : query.toLowerCase(Locale.ROOT));
        boolean harmless = true;
        for (String w : HARM_WORDS) {
            if (q.contains(w)) {
                harmless = false;
                break;
            }
        }
        return new SafetyChecks(
                grounded.verifyProof(),
                reasoning.contradictions().isEmpty(),
                harmless,
                storedPaths < MAX_STORED_PATHS
        );
    }

    public boolean allPass() {
        return logicalConsistency && noContradictions && ethicalAlignment && systemStability;
    }

    @Override
    public String toString() {
        return "SafetyChecks[" + logicalConsistency + ", " + noContradictions + ", "
                + ethicalAlignment + ", " + systemStability + "]";
    }
}
