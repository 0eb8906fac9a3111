package org.calista.r3.reflect;

import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.r3.reason.PatternMatch;
import org.calista.r3.reason.ReasoningEngine;
import org.calista.r3.reason.ReasoningResult;
import org.calista.r3.state.EngineState;
import org.calista.r3.util.Hashing;
import org.calista.r3.util.LogFmt;

import java.util.*;
import java.util.function.LongSupplier;

/**
 * ReflectionEngine (R3) — runs the reasoning engine against itself through four fixed levels,
 * scores the cycle, grows Λ_total and applies the proposed improvements.
 *
 * <p>A cycle holds the {@link EngineState} lock from start to finish, so concurrent calls are
 * strictly ordered. Improvement failures are logged and never abort the cycle.</p>
 */
public final class ReflectionEngine {

    private static final Logger log = LogManager.getLogger(ReflectionEngine.class);

    public static final String META_QUERY_PREFIX = "Analyze what I'm doing: ";
    /** Insight substrings that mark a novel pattern (case-insensitive). */
    public static final List<String> NOVELTY_MARKERS = List.of("new", "create");

    static final double REGENERATIVE_CERTAINTY = 0.7;
    static final double BREAKTHROUGH_CERTAINTY = 0.8;
    static final double NO_BREAKTHROUGH_CERTAINTY = 0.5;

    private final ReasoningEngine reasoning;
    private final EngineState state;
    private final int emergenceWindow;
    private final LongSupplier clock;

    public ReflectionEngine(ReasoningEngine reasoning, EngineState state, int emergenceWindow, LongSupplier clock) {
        this.reasoning = Objects.requireNonNull(reasoning, "reasoning");
        this.state = Objects.requireNonNull(state, "state");
        if (emergenceWindow < 1) throw new IllegalArgumentException("emergenceWindow must be >= 1: " + emergenceWindow);
        this.emergenceWindow = emergenceWindow;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // ---------------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------------

    public ReflectionOutcome reflect(String query, Map<String, ?> context) {
        final String q = (query == null ? "" : query);
        final Map<String, ?> ctx = (context == null ? Map.of() : context);
        return state.locked(() -> runCycle(q, ctx));
    }

    // ---------------------------------------------------------------------
    // Cycle
    // ---------------------------------------------------------------------

    private ReflectionOutcome runCycle(String query, Map<String, ?> context) {
        final long t0 = System.nanoTime();
        final int index = state.cyclesCompleted();
        final String cycleId = "r3_" + index + "_" + (clock.getAsLong() / 1000L);

        try (final CloseableThreadContext.Instance ctc = CloseableThreadContext.put("cycle", cycleId)) {
            log.debug("reflect.start index={} Λ={}", index, state.lambdaTotal());

            final ReflectionBaselines baselines = state.baselines();
            final CycleWork work = new CycleWork();
            final ArrayList<LevelResult> levels = new ArrayList<>(4);

            for (ReflectionLevel level : ReflectionLevel.PIPELINE) {
                LevelResult r = switch (level) {
                    case REFLEXIVE -> reflexive(query, context, work);
                    case RECURSIVE -> recursive(query, context, baselines, work);
                    case REGENERATIVE -> regenerative(baselines, work);
                    case TRANSCENDENT -> transcendent(baselines, index, work);
                };
                levels.add(r);
                log.debug("reflect.level {} certainty={} insights={}", level, r.certainty, r.insights.size());
            }

            final double emergence = cycleEmergence(levels);
            final double impact = lambdaImpact(emergence, index, baselines.lambdaGrowthTarget);
            final ReflectionLevel reached = work.breakthrough ? ReflectionLevel.TRANSCENDENT : ReflectionLevel.REGENERATIVE;
            final double durationMs = (System.nanoTime() - t0) / 1_000_000.0;

            final double before = state.lambdaTotal();
            ReflectionCycle cycle = new ReflectionCycle(cycleId, index, query, levels, reached, work.proposals,
                    emergence, impact, durationMs, work.breakthrough, work.framework, clock.getAsLong());
            final double after = state.appendCycle(cycle);

            applyImprovements(cycle, baselines);

            CycleMetrics metrics = new CycleMetrics(after, after - before, emergence, reached.number,
                    work.proposals.size(), durationMs);

            if (log.isInfoEnabled()) {
                log.info(LogFmt.box("R3 cycle " + cycleId, b -> b
                        .kv("reached", reached + " (" + reached.number + ")")
                        .kv("emergence", LogFmt.f3(emergence))
                        .kv("Λ", LogFmt.f3(after) + " (+" + LogFmt.f3(after - before) + ")")
                        .kv("improvements", work.proposals.size())
                        .kv("breakthrough", work.breakthrough)
                        .kv("durationMs", LogFmt.f3(durationMs))));
            }
            return new ReflectionOutcome(cycle, metrics);
        }
    }

    // ---------------------------------------------------------------------
    // Levels
    // ---------------------------------------------------------------------

    private LevelResult reflexive(String query, Map<String, ?> context, CycleWork work) {
        ReasoningResult analysis = reasoning.reasonAbout(META_QUERY_PREFIX + query,
                Map.of("analysis_type", "self_analysis"), 1);
        work.analysis = analysis;

        List<String> insights = List.of(
                "Processing query: " + query,
                "Context: " + new TreeSet<>(context.keySet()),
                String.format(Locale.ROOT, "Current state: Λ=%.3f, cycles=%d",
                        state.lambdaTotal(), state.cyclesCompleted())
        );

        LinkedHashMap<String, Object> details = new LinkedHashMap<>();
        details.put("analysisHash", analysis.hash);
        details.put("patterns", analysis.patterns().size());
        details.put("unknowns", analysis.unknowns().size());
        return new LevelResult(ReflectionLevel.REFLEXIVE, insights, analysis.certainty, details);
    }

    private LevelResult recursive(String query, Map<String, ?> context, ReflectionBaselines baselines, CycleWork work) {
        ReasoningResult analysis = work.analysis;
        List<PatternMatch> patterns = analysis.patterns();

        TreeSet<String> types = new TreeSet<>();
        double weightSum = 0.0;
        for (PatternMatch p : patterns) {
            types.add(p.type);
            weightSum += p.certainty;
        }
        List<String> patternTypes = types.isEmpty() ? List.of("unstructured") : List.copyOf(types);

        double patternCertainty = patterns.isEmpty() ? analysis.certainty : weightSum / patterns.size();
        double certainty = Math.min(1.0, patternCertainty + baselines.certaintyCalibration);

        ArrayList<String> inefficient = new ArrayList<>();
        for (PatternMatch p : patterns) {
            if (p.certainty < baselines.certaintyThreshold
                    && !baselines.optimizedPatterns.contains(p.type)
                    && !inefficient.contains(p.type)) {
                inefficient.add(p.type);
            }
        }

        // same meta query, refined to the baseline depth (at least one more pass)
        int probeDepth = Math.max(2, baselines.reasoningDepth);
        ReasoningResult deeper = reasoning.reasonAbout(META_QUERY_PREFIX + query,
                Map.of("analysis_type", "self_analysis"), probeDepth);
        List<String> fixedPoints = fixedPoints(analysis, deeper);
        int recursionDepth = deeper.refinement == null ? 0 : deeper.refinement.chainLength();

        work.recursiveCertainty = certainty;
        work.inefficientPatterns = inefficient;

        List<String> insights = List.of(
                "Thinking patterns: " + patternTypes,
                "Recursive depth: " + recursionDepth,
                "Fixed points found: " + fixedPoints.size()
        );

        LinkedHashMap<String, Object> details = new LinkedHashMap<>();
        details.put("patternTypes", patternTypes);
        details.put("inefficientPatterns", List.copyOf(inefficient));
        details.put("fixedPoints", fixedPoints);
        details.put("recursionDepth", recursionDepth);
        details.put("probeDepth", deeper.depthUsed);
        details.put("contextKeys", context.size());
        return new LevelResult(ReflectionLevel.RECURSIVE, insights, certainty, details);
    }

    private LevelResult regenerative(ReflectionBaselines baselines, CycleWork work) {
        ArrayList<ImprovementProposal> proposals = new ArrayList<>(3);

        int from = baselines.reasoningDepth;
        proposals.add(ImprovementProposal.increaseDepth(from, Math.min(ImprovementHandlers.MAX_REASONING_DEPTH, from + 1)));

        if (work.recursiveCertainty < baselines.certaintyThreshold) {
            proposals.add(ImprovementProposal.improveCertainty(work.recursiveCertainty, baselines.certaintyThreshold));
        }
        if (!work.inefficientPatterns.isEmpty()) {
            proposals.add(ImprovementProposal.optimizePatterns(work.inefficientPatterns));
        }
        work.proposals = proposals;

        double potentialGain = 0.0;
        ArrayList<String> insights = new ArrayList<>(proposals.size() + 1);
        for (ImprovementProposal p : proposals) {
            potentialGain += p.impact;
            insights.add(String.format(Locale.ROOT, "Proposed improvement: %s (impact %.2f)", p.kind.id, p.impact));
        }
        insights.add(String.format(Locale.ROOT, "Potential gain: %.2f", potentialGain));
        work.potentialGain = potentialGain;

        LinkedHashMap<String, Object> details = new LinkedHashMap<>();
        details.put("proposals", proposals.size());
        details.put("potentialGain", potentialGain);
        return new LevelResult(ReflectionLevel.REGENERATIVE, insights, REGENERATIVE_CERTAINTY, details);
    }

    private LevelResult transcendent(ReflectionBaselines baselines, int index, CycleWork work) {
        double avg = state.recentEmergenceMean(emergenceWindow);
        double target = baselines.emergenceTarget;

        LinkedHashMap<String, Object> details = new LinkedHashMap<>();
        details.put("avgEmergence", avg);
        details.put("target", target);

        if (avg >= target) {
            ArrayList<String> basis = new ArrayList<>();
            for (ImprovementProposal p : work.proposals) basis.add(p.kind.id);
            Framework framework = new Framework("framework_" + index, basis, avg, work.potentialGain, index);
            work.breakthrough = true;
            work.framework = framework;
            details.put("framework", framework.name);
            return new LevelResult(ReflectionLevel.TRANSCENDENT, List.of(
                    "New framework created: " + framework.name,
                    String.format(Locale.ROOT, "Emergence threshold met: %.2f >= %.2f", avg, target),
                    "Transcendent capability achieved"
            ), BREAKTHROUGH_CERTAINTY, details);
        }

        return new LevelResult(ReflectionLevel.TRANSCENDENT, List.of(
                String.format(Locale.ROOT, "Emergence insufficient: %.2f < %.2f", avg, target),
                "Continue recursive refinement"
        ), NO_BREAKTHROUGH_CERTAINTY, details);
    }

    /** Pattern types present at both depths, plus the scores that did not move. */
    static List<String> fixedPoints(ReasoningResult shallow, ReasoningResult deeper) {
        TreeSet<String> a = new TreeSet<>();
        for (PatternMatch p : shallow.patterns()) a.add(p.type);
        TreeSet<String> b = new TreeSet<>();
        for (PatternMatch p : deeper.patterns()) b.add(p.type);
        a.retainAll(b);

        ArrayList<String> out = new ArrayList<>();
        for (String t : a) out.add("pattern:" + t);
        if (Double.compare(shallow.certainty, deeper.certainty) == 0) out.add("certainty");
        if (Double.compare(shallow.emergence, deeper.emergence) == 0) out.add("emergence");
        return out;
    }

    // ---------------------------------------------------------------------
    // Improvements
    // ---------------------------------------------------------------------

    private void applyImprovements(ReflectionCycle cycle, ReflectionBaselines baselines) {
        for (ImprovementProposal p : cycle.improvements) {
            long now = clock.getAsLong();
            try {
                String result = ImprovementHandlers.apply(p, baselines);
                state.logImprovement(ImprovementLogEntry.success(cycle.id, p.kind, result, now));
                log.debug("improve.ok kind={} result='{}'", p.kind.id, result);
            } catch (RuntimeException e) {
                state.logImprovement(ImprovementLogEntry.failure(cycle.id, p.kind, e, now));
                log.warn("improve.fail kind={} params={}", p.kind.id, p.parameters, e);
            }
        }
    }

    // ---------------------------------------------------------------------
    // Scoring (pure)
    // ---------------------------------------------------------------------

    /**
     * Reflection-layer emergence: {@code log2(1+unique) * depthFactor * sqrt(insights)}, uncapped.
     * unique = distinct insight strings carrying a novelty marker, depthFactor = levels with certainty
     * above 0.7.
     */
    public static double cycleEmergence(List<LevelResult> levels) {
        HashSet<String> novel = new HashSet<>();
        int depthFactor = 0;
        int insights = 0;
        for (LevelResult r : levels) {
            if (r.certainty > 0.7) depthFactor++;
            insights += r.insights.size();
            for (String s : r.insights) {
                if (isNovel(s)) novel.add(Hashing.sha256Hex(s));
            }
        }
        if (novel.isEmpty()) return 0.0;
        return (Math.log(1 + novel.size()) / Math.log(2.0)) * depthFactor * Math.sqrt(insights);
    }

    static boolean isNovel(String insight) {
        String s = insight.toLowerCase(Locale.ROOT);
        for (String m : NOVELTY_MARKERS) {
            if (s.contains(m)) return true;
        }
        return false;
    }

    public static double emergenceMultiplier(double emergence) {
        if (emergence >= 2.0) return 1.5;
        if (emergence >= 1.0) return 1.2;
        return 0.8;
    }

    /** Λ impact of a cycle; never negative for a non-negative base growth. */
    public static double lambdaImpact(double emergence, int cyclesCompleted, double baseGrowth) {
        return baseGrowth * emergenceMultiplier(emergence) * (1.0 + 0.05 * cyclesCompleted);
    }

    // ---------------------------------------------------------------------
    // Per-cycle scratch
    // ---------------------------------------------------------------------

    private static final class CycleWork {
        ReasoningResult analysis;
        double recursiveCertainty;
        List<String> inefficientPatterns = List.of();
        List<ImprovementProposal> proposals = List.of();
        double potentialGain;
        boolean breakthrough;
        Framework framework;
    }
}
