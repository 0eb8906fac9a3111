package org.calista.r3.reflect;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Static handler table, one entry per {@link ImprovementKind}.
 */
public final class ImprovementHandlers {

    public static final int MAX_REASONING_DEPTH = 10;
    /** Upper bound of the certainty calibration bonus. */
    public static final double MAX_CALIBRATION = 0.3;
    /** Largest calibration step a single proposal may apply. */
    public static final double CALIBRATION_STEP = 0.05;

    private static final Map<ImprovementKind, ImprovementHandler> TABLE = table();

    private ImprovementHandlers() {}

    private static Map<ImprovementKind, ImprovementHandler> table() {
        EnumMap<ImprovementKind, ImprovementHandler> m = new EnumMap<>(ImprovementKind.class);
        m.put(ImprovementKind.INCREASE_REASONING_DEPTH, ImprovementHandlers::increaseDepth);
        m.put(ImprovementKind.IMPROVE_CERTAINTY, ImprovementHandlers::improveCertainty);
        m.put(ImprovementKind.OPTIMIZE_PATTERNS, ImprovementHandlers::optimizePatterns);
        return Collections.unmodifiableMap(m);
    }

    public static ImprovementHandler forKind(ImprovementKind kind) {
        ImprovementHandler h = TABLE.get(Objects.requireNonNull(kind, "kind"));
        if (h == null) throw new IllegalStateException("No handler for " + kind);
        return h;
    }

    public static String apply(ImprovementProposal proposal, ReflectionBaselines baselines) {
        Objects.requireNonNull(proposal, "proposal");
        Objects.requireNonNull(baselines, "baselines");
        return forKind(proposal.kind).apply(proposal, baselines);
    }

    // =========================
    // Handlers
    // =========================

    static String increaseDepth(ImprovementProposal p, ReflectionBaselines b) {
        int to = Math.min(MAX_REASONING_DEPTH, p.intParam("to"));
        int from = b.reasoningDepth;
        if (to <= from) return "reasoning depth unchanged at " + from;
        b.reasoningDepth = to;
        return "reasoning depth " + from + " -> " + to;
    }

    static String improveCertainty(ImprovementProposal p, ReflectionBaselines b) {
        double gap = p.doubleParam("target") - p.doubleParam("current");
        if (!(gap > 0.0)) {
            throw new IllegalStateException("certainty already at target");
        }
        if (b.certaintyCalibration >= MAX_CALIBRATION) {
            throw new IllegalStateException("certainty calibration exhausted at " + MAX_CALIBRATION);
        }
        double before = b.certaintyCalibration;
        b.certaintyCalibration = Math.min(MAX_CALIBRATION, before + Math.min(CALIBRATION_STEP, gap));
        return String.format(Locale.ROOT, "certainty calibration %.3f -> %.3f", before, b.certaintyCalibration);
    }

    static String optimizePatterns(ImprovementProposal p, ReflectionBaselines b) {
        List<String> patterns = p.listParam("patterns");
        if (patterns.isEmpty()) {
            throw new IllegalArgumentException("no patterns to optimize");
        }
        int before = b.optimizedPatterns.size();
        b.optimizedPatterns.addAll(patterns);
        return "optimized patterns " + (b.optimizedPatterns.size() - before) + " added, total " + b.optimizedPatterns.size();
    }
}
