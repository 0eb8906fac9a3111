package org.calista.r3.service;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.r3.axiom.GroundedStatement;
import org.calista.r3.core.R3Engine;
import org.calista.r3.reason.ReasoningResult;
import org.calista.r3.reflect.ReflectionOutcome;
import org.calista.r3.state.ConvergenceReport;
import org.calista.r3.store.RecordSink;

import java.io.IOException;
import java.util.*;
import java.util.function.LongSupplier;

/**
 * R3System — the per-query pipeline around {@link R3Engine}:
 * validate, ground, reason, reflect, store the path, update session metrics, check requirements.
 *
 * <p>{@link #process(String)} is serialized; session counters and the reflection history advance
 * together. Persistence happens only after the path is final.</p>
 */
public final class R3System {

    private static final Logger log = LogManager.getLogger(R3System.class);

    public static final int MAX_OPTIMAL_DEPTH = 10;
    private static final int RECENT_GROUNDINGS = 10;
    private static final int RECENT_SAFETY = 5;

    private final R3Engine engine;
    private final RecordSink sink;
    private final int maxQueryChars;
    private final LongSupplier clock;
    private final String sessionId;

    // session metrics
    private int queriesProcessed;
    private int pathsStored;
    private int fallbackGroundings;
    private final ArrayList<Double> groundingScores = new ArrayList<>();
    private final ArrayList<Double> emergenceScores = new ArrayList<>();
    private final ArrayList<Integer> reasoningDepths = new ArrayList<>();
    private final ArrayList<Double> certaintyScores = new ArrayList<>();
    private final ArrayDeque<SafetyChecks> recentSafety = new ArrayDeque<>();

    public R3System(R3Engine engine, RecordSink sink, int maxQueryChars, LongSupplier clock) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.sink = Objects.requireNonNull(sink, "sink");
        if (maxQueryChars < 1) throw new IllegalArgumentException("maxQueryChars must be >= 1: " + maxQueryChars);
        this.maxQueryChars = maxQueryChars;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sessionId = "r3_" + (clock.getAsLong() / 1000L);
    }

    // ---------------------------------------------------------------------
    // Pipeline
    // ---------------------------------------------------------------------

    /**
     * @throws IllegalArgumentException for a blank or over-long query
     * @throws IOException              if the path could not be stored
     */
    public synchronized PipelineResult process(String query) throws IOException {
        validateQuery(query, maxQueryChars);

        final int queryNumber = ++queriesProcessed;

        GroundedStatement grounded = engine.ground(query, Map.of("query_number", queryNumber));

        LinkedHashMap<String, Object> reasoningCtx = new LinkedHashMap<>();
        reasoningCtx.put("grounded_hash", grounded.hash);
        reasoningCtx.put("grounding_certainty", grounded.certainty);
        int depth = optimalDepth(query);
        ReasoningResult reasoning = engine.reasonAbout(query, reasoningCtx, depth);

        LinkedHashMap<String, Object> reflectCtx = new LinkedHashMap<>();
        reflectCtx.put("reasoning_hash", reasoning.hash);
        reflectCtx.put("reasoning_certainty", reasoning.certainty);
        ReflectionOutcome outcome = engine.reflect(query, reflectCtx);

        final long now = clock.getAsLong();
        String pathId = "path_" + pathsStored + "_" + (now / 1000L);
        SafetyChecks safety = SafetyChecks.evaluate(query, grounded, reasoning, pathsStored);
        ReasoningPath path = new ReasoningPath(pathId, query, grounded, reasoning, outcome.cycle,
                outcome.metrics.lambdaGrowth, safety, engine.convergence(), now);

        sink.append(path.id, path);
        pathsStored++;

        recordMetrics(grounded, reasoning, outcome, safety);
        RequirementsReport validation = validateRequirements();

        log.info("process: #{} depth={} grounding={} certainty={} emergence={} Λ={} safety={} requirements={}/{}",
                queryNumber, reasoning.depthUsed, grounded.certainty, reasoning.certainty,
                outcome.cycle.emergence, outcome.metrics.lambdaTotal, safety.allPass(),
                Math.round(validation.score * validation.requirements.size()), validation.requirements.size());

        return new PipelineResult(sessionId, path, outcome.metrics, validation, sessionMetrics());
    }

    private void recordMetrics(GroundedStatement g, ReasoningResult r, ReflectionOutcome o, SafetyChecks s) {
        groundingScores.add(g.certainty);
        if (g.fallback) fallbackGroundings++;
        emergenceScores.add(o.cycle.emergence);
        reasoningDepths.add(r.depthUsed);
        certaintyScores.add(r.certainty);
        recentSafety.addLast(s);
        while (recentSafety.size() > RECENT_SAFETY) recentSafety.removeFirst();
    }

    // ---------------------------------------------------------------------
    // Requirements
    // ---------------------------------------------------------------------

    public synchronized RequirementsReport validateRequirements() {
        SessionMetrics m = sessionMetrics();
        LinkedHashMap<String, Boolean> req = new LinkedHashMap<>();

        req.put("all_reasoning_axiom_grounded", m.groundingAvg >= 0.95);
        req.put("every_step_traces_to_axioms", recentGroundingsAbove(0.8));
        req.put("ontological_grounding_complete", queriesProcessed > 0 && fallbackGroundings == 0);
        req.put("all_reasoning_paths_stored", pathsStored == queriesProcessed);
        req.put("concept_graph_loaded", engine.graph().size() > 0);
        req.put("unified_performance_metric", m.lambdaTotal > 0.0);
        req.put("self_optimizing_r3", m.cyclesCompleted > 0);
        req.put("safety_validation", !recentSafety.isEmpty() && recentSafety.stream().allMatch(SafetyChecks::allPass));
        req.put("tracking_emergence", m.emergenceAvg >= 0.0);
        req.put("detecting_convergence", engine.convergence().confidence > 0.0);

        return new RequirementsReport(req);
    }

    private boolean recentGroundingsAbove(double threshold) {
        if (groundingScores.isEmpty()) return false;
        int from = Math.max(0, groundingScores.size() - RECENT_GROUNDINGS);
        for (int i = from; i < groundingScores.size(); i++) {
            if (!(groundingScores.get(i) > threshold)) return false;
        }
        return true;
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    /**
     * {@code min(10, 2 + min(5, floor(words/10*3)) + min(3, floor(questionWords/words*5)))}, where a
     * question word is a whitespace separated word ending in '?'.
     */
    public static int optimalDepth(String query) {
        String q = (query == null ? "" : query.trim());
        String[] words = q.isEmpty() ? new String[0] : q.split("\\s+");
        int questionWords = 0;
        for (String w : words) {
            if (w.endsWith("?")) questionWords++;
        }
        double complexity = words.length / 10.0;
        double uncertainty = (double) questionWords / Math.max(1, words.length);

        int complexityBonus = Math.min(5, (int) (complexity * 3));
        int uncertaintyBonus = Math.min(3, (int) (uncertainty * 5));
        return Math.min(MAX_OPTIMAL_DEPTH, 2 + complexityBonus + uncertaintyBonus);
    }

    public static void validateQuery(String query, int maxChars) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        if (query.length() > maxChars) {
            throw new IllegalArgumentException("query exceeds " + maxChars + " characters: " + query.length());
        }
    }

    public synchronized SessionMetrics sessionMetrics() {
        return new SessionMetrics(
                engine.state().lambdaTotal(),
                mean(groundingScores),
                mean(emergenceScores),
                meanInt(reasoningDepths),
                mean(certaintyScores),
                queriesProcessed,
                engine.state().cyclesCompleted(),
                pathsStored
        );
    }

    public ConvergenceReport convergence() {
        return engine.convergence();
    }

    public String sessionId() {
        return sessionId;
    }

    public R3Engine engine() {
        return engine;
    }

    private static double mean(List<Double> xs) {
        if (xs.isEmpty()) return 0.0;
        double s = 0.0;
        for (double x : xs) s += x;
        return s / xs.size();
    }

    private static double meanInt(List<Integer> xs) {
        if (xs.isEmpty()) return 0.0;
        long s = 0;
        for (int x : xs) s += x;
        return (double) s / xs.size();
    }

    // ---------------------------------------------------------------------
    // DTO
    // ---------------------------------------------------------------------

    public static final class SessionMetrics {
        public final double lambdaTotal;
        public final double groundingAvg;
        public final double emergenceAvg;
        public final double reasoningDepthAvg;
        public final double certaintyAvg;
        public final int queriesProcessed;
        public final int cyclesCompleted;
        public final int pathsStored;

        public SessionMetrics(double lambdaTotal, double groundingAvg, double emergenceAvg, double reasoningDepthAvg,
                              double certaintyAvg, int queriesProcessed, int cyclesCompleted, int pathsStored) {
            this.lambdaTotal = lambdaTotal;
            this.groundingAvg = groundingAvg;
            this.emergenceAvg = emergenceAvg;
            this.reasoningDepthAvg = reasoningDepthAvg;
            this.certaintyAvg = certaintyAvg;
            this.queriesProcessed = queriesProcessed;
            this.cyclesCompleted = cyclesCompleted;
            this.pathsStored = pathsStored;
        }
    }
}
