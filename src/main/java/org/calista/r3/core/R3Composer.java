package org.calista.r3.core;

import org.calista.r3.axiom.AxiomGrounder;
import org.calista.r3.reason.ComponentExtractor;
import org.calista.r3.reason.ConceptGraph;
import org.calista.r3.reason.ReasoningEngine;
import org.calista.r3.reason.impl.LexicalComponentExtractor;
import org.calista.r3.reflect.ReflectionBaselines;
import org.calista.r3.reflect.ReflectionEngine;
import org.calista.r3.state.ConvergenceDetector;
import org.calista.r3.state.EngineSnapshot;
import org.calista.r3.state.EngineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * R3Composer — wires an {@link R3Engine} from config: state, concept graph, extractor, the three
 * engines and the convergence detector.
 */
public final class R3Composer {

    private static final Logger log = LoggerFactory.getLogger(R3Composer.class);

    private ComponentExtractor extractor = new LexicalComponentExtractor();
    private ConceptGraph graph;
    private LongSupplier clock = System::currentTimeMillis;

    public R3Composer extractor(ComponentExtractor extractor) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        return this;
    }

    /** Concept graph to reason against; defaults to a fresh graph with the logical operators. */
    public R3Composer graph(ConceptGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
        return this;
    }

    public R3Composer clock(LongSupplier clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        return this;
    }

    /**
     * Builds an engine for the kernel's config. With {@code state.resume} the last snapshot, if any,
     * is restored into the fresh state.
     */
    public R3Engine buildEngine(R3Kernel kernel) throws IOException {
        Objects.requireNonNull(kernel, "kernel");
        R3Engine engine = buildEngine(kernel.config());

        if (kernel.config().state.resume) {
            Optional<EngineSnapshot> snap = kernel.snapshotStore().load();
            if (snap.isPresent()) {
                engine.state().restore(snap.get());
            } else {
                log.info("state.resume is set but no snapshot exists yet: {}", kernel.snapshotStore().file());
            }
        }
        return engine;
    }

    public R3Engine buildEngine(R3Config cfg) {
        Objects.requireNonNull(cfg, "cfg");
        cfg.validate();

        ReflectionBaselines baselines = new ReflectionBaselines();
        baselines.reasoningDepth = cfg.reflection.reasoningDepth;
        baselines.certaintyThreshold = cfg.reflection.certaintyThreshold;
        baselines.emergenceTarget = cfg.reflection.emergenceTarget;
        baselines.lambdaGrowthTarget = cfg.reflection.lambdaGrowthTarget;

        EngineState state = new EngineState(cfg.reflection.initialLambda, baselines, cfg.reasoning.cacheCapacity);
        ConceptGraph g = (graph != null) ? graph : ConceptGraph.withLogicalOperators();

        AxiomGrounder grounder = new AxiomGrounder(clock);
        ReasoningEngine reasoning = new ReasoningEngine(extractor, g, state,
                cfg.reasoning.maxDepth, cfg.reasoning.maxImplications, clock);
        ReflectionEngine reflection = new ReflectionEngine(reasoning, state, cfg.reflection.emergenceWindow, clock);
        ConvergenceDetector convergence = new ConvergenceDetector(cfg.convergence.window, cfg.convergence.minSamples,
                cfg.convergence.avgChangeThreshold, cfg.convergence.stdChangeThreshold);

        log.info("Building R3 engine: maxDepth={}, cacheCapacity={}, Λ0={}, concepts={}",
                cfg.reasoning.maxDepth, cfg.reasoning.cacheCapacity, cfg.reflection.initialLambda, g.size());
        return new R3Engine(grounder, reasoning, reflection, convergence, state);
    }
}
