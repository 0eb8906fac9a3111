package org.calista.r3;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.r3.core.R3Composer;
import org.calista.r3.core.R3Engine;
import org.calista.r3.core.R3Kernel;
import org.calista.r3.service.PipelineResult;
import org.calista.r3.service.R3System;
import org.calista.r3.state.ConvergenceReport;
import org.calista.r3.state.EngineMetrics;
import org.calista.r3.store.R3Event;
import org.calista.r3.util.LogFmt;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * R3App — console runner.
 *
 * Lifecycle:
 *  1) build kernel (config, IO, stores)
 *  2) compose the engine (restores state when configured)
 *  3) process the command-line queries, or run the console loop
 *  4) snapshot the engine state
 */
public final class R3App {

    private static final Logger log = LogManager.getLogger(R3App.class);

    private final Path configRoot;
    private final Path cfgPath;
    private final LongSupplier clock;

    private R3Kernel kernel;
    private R3Engine engine;
    private R3System system;
    private long processed;

    public static void main(String[] args) throws Exception {
        R3App app = new R3App();
        if (args.length > 0) {
            app.runQueries(List.of(args), System.out);
        } else {
            app.runConsole(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
        }
    }

    public R3App() {
        this(Path.of("."), Path.of("config/config.json"), System::currentTimeMillis);
    }

    public R3App(Path configRoot, Path cfgPath, LongSupplier clock) {
        this.configRoot = configRoot;
        this.cfgPath = cfgPath;
        this.clock = clock;
    }

    private void start() throws IOException {
        if (kernel != null) return;
        kernel = R3Kernel.builder()
                .configRoot(configRoot)
                .clock(clock)
                .build(cfgPath);
        engine = new R3Composer().clock(clock).buildEngine(kernel);
        system = new R3System(engine, kernel.recordSink(), kernel.config().requests.maxQueryChars, clock);
        log.info("R3 started. session={} Λ={}", system.sessionId(), engine.state().lambdaTotal());
    }

    // ---------------------------------------------------------------------
    // Modes
    // ---------------------------------------------------------------------

    public void runQueries(List<String> queries, PrintStream out) throws IOException {
        start();
        for (String q : queries) handleQuery(q, out);
        saveSnapshot();
    }

    public void runConsole(BufferedReader in, PrintStream out) throws IOException {
        start();
        out.println("Type a query, 'metrics', 'convergence' or 'exit'.");
        while (true) {
            out.print("> ");
            String line = in.readLine();
            if (line == null) break;

            line = line.trim();
            if (line.equalsIgnoreCase("exit")) break;
            if (line.isEmpty()) continue;

            if (line.equalsIgnoreCase("metrics")) {
                out.println(formatMetrics(engine.getMetrics()));
                continue;
            }
            if (line.equalsIgnoreCase("convergence")) {
                out.println(formatConvergence(engine.convergence()));
                continue;
            }
            handleQuery(line, out);
        }
        saveSnapshot();
        out.println("Bye. Snapshot saved.");
    }

    private void handleQuery(String query, PrintStream out) throws IOException {
        String sessionId = system.sessionId();
        kernel.eventStore().append(R3Event.of(R3Event.QUERY, sessionId, query, clock.getAsLong()));

        PipelineResult r;
        try {
            r = system.process(query);
        } catch (IllegalArgumentException e) {
            out.println("Rejected: " + e.getMessage());
            return;
        }

        out.println(formatResult(r));
        kernel.eventStore().append(R3Event.of(R3Event.RESULT, sessionId, r.path.id, clock.getAsLong()));

        processed++;
        int every = kernel.config().state.autoSnapshotEveryQueries;
        if (every > 0 && processed % every == 0) saveSnapshot();
    }

    private void saveSnapshot() throws IOException {
        kernel.snapshotStore().save(engine.state().snapshot(clock.getAsLong()));
        kernel.eventStore().append(R3Event.of(R3Event.SNAPSHOT, system.sessionId(),
                kernel.snapshotStore().file().getFileName().toString(), clock.getAsLong()));
    }

    // ---------------------------------------------------------------------
    // Formatting
    // ---------------------------------------------------------------------

    static String formatResult(PipelineResult r) {
        return LogFmt.box("R3 " + r.path.id, b -> b
                .line("session " + r.sessionId)
                .kv("grounding", LogFmt.f3(r.path.groundingCertainty))
                .kv("depth", r.path.reasoningDepth)
                .kv("certainty", LogFmt.f3(r.path.reasoning.certainty))
                .kv("emergence", LogFmt.f3(r.path.emergence))
                .kv("Λ", LogFmt.f3(r.cycleMetrics.lambdaTotal) + " (+" + LogFmt.f3(r.cycleMetrics.lambdaGrowth) + ")")
                .kv("safety", r.path.safety.allPass() ? "pass" : "FAIL " + r.path.safety)
                .sep()
                .kv("requirements", r.validation.allMet ? "all met" : LogFmt.f3(r.validation.score)));
    }

    static String formatMetrics(EngineMetrics m) {
        return LogFmt.box("R3 metrics", b -> b
                .kv("avgCertainty", LogFmt.f3(m.avgCertainty))
                .kv("avgEmergence", LogFmt.f3(m.avgEmergence))
                .kv("cacheHitRate", LogFmt.f3(m.cacheHitRate))
                .kv("Λ", LogFmt.f3(m.lambdaTotal))
                .kv("cycles", m.cyclesCompleted)
                .kv("converged", m.convergence.converged));
    }

    static String formatConvergence(ConvergenceReport c) {
        return LogFmt.box("R3 convergence", b -> b
                .kv("converged", c.converged)
                .kv("confidence", LogFmt.f3(c.confidence))
                .kv("avgChange", LogFmt.f3(c.avgChange))
                .kv("stdChange", LogFmt.f3(c.stdChange))
                .kv("samples", c.samples));
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public R3Kernel getKernel() { return kernel; }

    public R3Engine getEngine() { return engine; }

    public R3System getSystem() { return system; }

    public Path getCfgPath() { return cfgPath; }
}
