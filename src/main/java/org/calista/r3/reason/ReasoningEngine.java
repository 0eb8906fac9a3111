package org.calista.r3.reason;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.r3.state.EngineState;
import org.calista.r3.text.ContradictionMarkers;

import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.function.LongSupplier;

/**
 * ReasoningEngine — component extraction, base reasoning against the concept graph, bounded recursive
 * refinement, certainty and emergence scoring. Results are memoized in {@link EngineState}.
 *
 * <p>Given identical (query, context, depth) and an unchanged concept graph, the result content is
 * identical; the second call is a cache hit. Mutating the graph invalidates the cache.</p>
 */
public final class ReasoningEngine {

    private static final Logger log = LogManager.getLogger(ReasoningEngine.class);

    public static final double EMERGENCE_CAP = 5.0;
    public static final double MIN_CERTAINTY = 0.1;

    private final ComponentExtractor extractor;
    private final ConceptGraph graph;
    private final EngineState state;
    private final int maxDepth;
    private final int maxImplications;
    private final LongSupplier clock;

    private volatile long seenGraphVersion;

    // stats
    private final AtomicLong computed = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong depthSum = new AtomicLong();
    private final AtomicLong totalNanos = new AtomicLong();
    private final DoubleAdder certaintySum = new DoubleAdder();

    public ReasoningEngine(ComponentExtractor extractor,
                           ConceptGraph graph,
                           EngineState state,
                           int maxDepth,
                           int maxImplications,
                           LongSupplier clock) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.graph = Objects.requireNonNull(graph, "graph");
        this.state = Objects.requireNonNull(state, "state");
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1: " + maxDepth);
        if (maxImplications < 0) throw new IllegalArgumentException("maxImplications must be >= 0: " + maxImplications);
        this.maxDepth = maxDepth;
        this.maxImplications = maxImplications;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.seenGraphVersion = graph.version();
    }

    // ---------------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------------

    /**
     * The result carries the whitespace-normalized query, so a cache hit for {@code "a  b "} and a fresh
     * computation for {@code "a b"} report the same query and hash.
     *
     * @param depth requested depth; clamped to [1, maxDepth]
     */
    public ReasoningResult reasonAbout(String query, Map<String, ?> context, int depth) {
        final int d = clampDepth(depth);
        final long t0 = System.nanoTime();

        invalidateOnGraphChange();

        ReasoningCacheKey key = ReasoningCacheKey.of(query, context, d);
        final String q = key.query;
        Optional<ReasoningResult> hit = state.cachedReasoning(key);
        if (hit.isPresent()) {
            cacheHits.incrementAndGet();
            totalNanos.addAndGet(System.nanoTime() - t0);
            log.debug("reason: cache hit depth={} hash={}", d, hit.get().hash);
            return hit.get();
        }

        Components components = extractor.extract(q);
        BaseReasoning base = baseReasoning(components);

        RefinementPass refinement = null;
        if (base.needsRefinement && d > 1) {
            refinement = refine(base.unknowns, base.contradictions, base.knownEntities, d - 1, new HashSet<>());
        }

        List<Refinement> all = (refinement == null ? List.of() : refinement.allRefinements());
        List<Refinement> novel = distinctByDigest(all);

        double certainty = certainty(base.unknowns.size(), base.contradictions.size(), all.size(), base.patterns.size());
        double emergence = emergence(novel.size(), d, base.patterns.size() + base.directInferences.size());

        ReasoningResult result = new ReasoningResult(q, components, base, refinement, novel,
                certainty, emergence, d, clock.getAsLong());
        state.cacheReasoning(key, result);

        computed.incrementAndGet();
        depthSum.addAndGet(d);
        certaintySum.add(certainty);
        totalNanos.addAndGet(System.nanoTime() - t0);

        log.debug("reason: depth={} unknowns={} contradictions={} patterns={} refinements={} certainty={} emergence={}",
                d, base.unknowns.size(), base.contradictions.size(), base.patterns.size(), all.size(), certainty, emergence);
        return result;
    }

    public ConceptGraph graph() {
        return graph;
    }

    public int maxDepth() {
        return maxDepth;
    }

    public int clampDepth(int depth) {
        return Math.max(1, Math.min(maxDepth, depth));
    }

    public Stats stats() {
        long n = computed.get();
        long hits = cacheHits.get();
        long requests = n + hits;
        double totalMs = totalNanos.get() / 1_000_000.0;
        return new Stats(
                n,
                hits,
                n == 0 ? 0.0 : (double) depthSum.get() / n,
                totalMs,
                requests == 0 ? 0.0 : totalMs / requests,
                requests == 0 ? 0.0 : (double) hits / requests,
                state.reasoningCacheSize(),
                graph.size(),
                n == 0 ? 0.0 : certaintySum.sum() / n
        );
    }

    // ---------------------------------------------------------------------
    // Scoring (pure)
    // ---------------------------------------------------------------------

    public static double certainty(int unknowns, int contradictions, int refinements, int patterns) {
        double c = 0.7
                - 0.1 * unknowns
                - 0.2 * contradictions
                + Math.min(0.3, 0.05 * refinements)
                + 0.05 * patterns;
        return Math.max(MIN_CERTAINTY, Math.min(1.0, c));
    }

    /**
     * Reasoning-layer emergence: {@code log2(1+unique) * (1 + 0.1*depth) * sqrt(complexity)}, capped at
     * {@link #EMERGENCE_CAP}; 0 without novel insights.
     */
    public static double emergence(int uniqueInsights, int depth, int complexity) {
        if (uniqueInsights <= 0) return 0.0;
        double depthFactor = 1.0 + 0.1 * depth;
        double e = log2(1 + uniqueInsights) * depthFactor * Math.sqrt(Math.max(0, complexity));
        return Math.min(EMERGENCE_CAP, e);
    }

    private static double log2(double x) {
        return Math.log(x) / Math.log(2.0);
    }

    // ---------------------------------------------------------------------
    // Base reasoning
    // ---------------------------------------------------------------------

    BaseReasoning baseReasoning(Components c) {
        ArrayList<Inference> inferences = new ArrayList<>();
        ArrayList<String> contradictions = new ArrayList<>();
        LinkedHashSet<String> unknowns = new LinkedHashSet<>();
        LinkedHashSet<String> known = new LinkedHashSet<>();

        for (String e : c.entities) {
            if (graph.contains(e)) {
                if (known.add(e)) inferences.add(Inference.entityKnown(e, graph.related(e)));
            } else {
                unknowns.add(e);
            }
        }

        for (Relation r : c.relations) {
            if (r.isWellFormed()) {
                inferences.add(Inference.relationValid(r));
            } else {
                contradictions.add("Invalid relation: " + r);
            }
        }

        if (ContradictionMarkers.inComponents(c.flatten())) {
            contradictions.add("Logical contradiction detected in components");
        }

        return new BaseReasoning(inferences, contradictions, new ArrayList<>(unknowns), new ArrayList<>(known), patterns(c));
    }

    static List<PatternMatch> patterns(Components c) {
        ArrayList<PatternMatch> out = new ArrayList<>(3);
        if (c.connectives.contains("if") && c.connectives.contains("then")) {
            out.add(new PatternMatch(PatternMatch.IMPLICATION, PatternMatch.IMPLICATION_WEIGHT, "If-then logical structure"));
        }
        if (!c.quantifiers.isEmpty()) {
            out.add(new PatternMatch(PatternMatch.QUANTIFIED, PatternMatch.QUANTIFIED_WEIGHT,
                    "Quantified statement with " + c.quantifiers));
        }
        if (!c.actions.isEmpty()) {
            List<String> head = c.actions.subList(0, Math.min(2, c.actions.size()));
            out.add(new PatternMatch(PatternMatch.ACTION, PatternMatch.ACTION_WEIGHT, "Action-oriented: " + head));
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Recursive refinement
    // ---------------------------------------------------------------------

    /**
     * One pass per call. Implications are one hop from the known frontier, at most {@code maxImplications}
     * per pass; each edge is visited once per reasoning call. Related concepts that are not graph keys
     * become the next pass's unknowns.
     */
    private RefinementPass refine(List<String> unknowns,
                                  List<String> contradictions,
                                  List<String> known,
                                  int remaining,
                                  Set<String> visitedEdges) {
        if (remaining <= 0) return RefinementPass.maxDepth(0);

        ArrayList<Refinement> out = new ArrayList<>();
        for (String u : unknowns) out.add(Refinement.hypothesis(u));
        for (String c : contradictions) out.add(Refinement.resolution(c));

        LinkedHashSet<String> nextUnknowns = new LinkedHashSet<>();
        ArrayList<String> nextKnown = new ArrayList<>();
        int budget = maxImplications;

        outer:
        for (String k : known) {
            for (String n : graph.related(k)) {
                if (budget <= 0) break outer;
                if (!visitedEdges.add(k + "\u0000" + n)) continue;
                out.add(Refinement.implication(k, n));
                budget--;
                if (graph.contains(n)) nextKnown.add(n);
                else nextUnknowns.add(n);
            }
        }

        RefinementPass next = null;
        if (!nextUnknowns.isEmpty()) {
            next = refine(new ArrayList<>(nextUnknowns), List.of(), nextKnown, remaining - 1, visitedEdges);
        }
        return new RefinementPass(remaining, out, new ArrayList<>(nextUnknowns), next);
    }

    private static List<Refinement> distinctByDigest(List<Refinement> all) {
        LinkedHashMap<String, Refinement> seen = new LinkedHashMap<>();
        for (Refinement r : all) seen.putIfAbsent(r.digest, r);
        return new ArrayList<>(seen.values());
    }

    private void invalidateOnGraphChange() {
        long v = graph.version();
        if (v == seenGraphVersion) return;
        synchronized (this) {
            if (v != seenGraphVersion) {
                int dropped = state.clearReasoningCache();
                seenGraphVersion = v;
                log.debug("reason: concept graph changed (v={}), dropped {} cached results", v, dropped);
            }
        }
    }

    // ---------------------------------------------------------------------
    // DTO
    // ---------------------------------------------------------------------

    public static final class Stats {
        public final long queriesProcessed;
        public final long cacheHits;
        public final double avgDepth;
        public final double totalTimeMs;
        public final double avgResponseMs;
        /** hits / (hits + computed) */
        public final double cacheHitRate;
        public final int cacheSize;
        public final int conceptCount;
        public final double avgCertainty;

        public Stats(long queriesProcessed, long cacheHits, double avgDepth, double totalTimeMs, double avgResponseMs,
                     double cacheHitRate, int cacheSize, int conceptCount, double avgCertainty) {
            this.queriesProcessed = queriesProcessed;
            this.cacheHits = cacheHits;
            this.avgDepth = avgDepth;
            this.totalTimeMs = totalTimeMs;
            this.avgResponseMs = avgResponseMs;
            this.cacheHitRate = cacheHitRate;
            this.cacheSize = cacheSize;
            this.conceptCount = conceptCount;
            this.avgCertainty = avgCertainty;
        }
    }
}
