package org.calista.r3.core;

import org.calista.r3.axiom.AxiomGrounder;
import org.calista.r3.axiom.GroundedStatement;
import org.calista.r3.reason.ConceptGraph;
import org.calista.r3.reason.ReasoningEngine;
import org.calista.r3.reason.ReasoningResult;
import org.calista.r3.reflect.ImprovementLogEntry;
import org.calista.r3.reflect.ReflectionEngine;
import org.calista.r3.reflect.ReflectionOutcome;
import org.calista.r3.state.ConvergenceDetector;
import org.calista.r3.state.ConvergenceReport;
import org.calista.r3.state.EngineMetrics;
import org.calista.r3.state.EngineState;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * R3Engine — the core operations over one owned {@link EngineState}.
 *
 * <p>Built by {@link R3Composer}. The engine performs no I/O; persistence belongs to the service layer.</p>
 */
public final class R3Engine {

    private final AxiomGrounder grounder;
    private final ReasoningEngine reasoning;
    private final ReflectionEngine reflection;
    private final ConvergenceDetector convergence;
    private final EngineState state;

    public R3Engine(AxiomGrounder grounder,
                    ReasoningEngine reasoning,
                    ReflectionEngine reflection,
                    ConvergenceDetector convergence,
                    EngineState state) {
        this.grounder = Objects.requireNonNull(grounder, "grounder");
        this.reasoning = Objects.requireNonNull(reasoning, "reasoning");
        this.reflection = Objects.requireNonNull(reflection, "reflection");
        this.convergence = Objects.requireNonNull(convergence, "convergence");
        this.state = Objects.requireNonNull(state, "state");
    }

    // ---------------------------------------------------------------------
    // Core operations
    // ---------------------------------------------------------------------

    public GroundedStatement ground(String statement, Map<String, ?> context) {
        return grounder.ground(statement, context);
    }

    public ReasoningResult reasonAbout(String query, Map<String, ?> context, int depth) {
        return reasoning.reasonAbout(query, context, depth);
    }

    public ReflectionOutcome reflect(String query, Map<String, ?> context) {
        return reflection.reflect(query, context);
    }

    public ConvergenceReport convergence() {
        return convergence.detect(state.lambdaHistory());
    }

    public EngineMetrics getMetrics() {
        ReasoningEngine.Stats rs = reasoning.stats();

        List<Double> emergence = state.emergenceHistory();
        double avgEmergence = 0.0;
        if (!emergence.isEmpty()) {
            double sum = 0.0;
            for (double e : emergence) sum += e;
            avgEmergence = sum / emergence.size();
        }

        long applied = 0;
        long failed = 0;
        for (ImprovementLogEntry e : state.improvementLog()) {
            if (e.success) applied++;
            else failed++;
        }

        return new EngineMetrics(
                rs.avgCertainty,
                avgEmergence,
                rs.cacheHitRate,
                state.lambdaTotal(),
                convergence(),
                state.cyclesCompleted(),
                rs.cacheSize,
                grounder.stats().avgCertainty,
                applied,
                failed
        );
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public AxiomGrounder grounder() { return grounder; }
    public ReasoningEngine reasoning() { return reasoning; }
    public ReflectionEngine reflection() { return reflection; }
    public ConceptGraph graph() { return reasoning.graph(); }
    public EngineState state() { return state; }
}
