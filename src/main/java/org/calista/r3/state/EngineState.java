package org.calista.r3.state;

import org.calista.r3.reason.ReasoningCacheKey;
import org.calista.r3.reason.ReasoningResult;
import org.calista.r3.reflect.ImprovementLogEntry;
import org.calista.r3.reflect.ReflectionBaselines;
import org.calista.r3.reflect.ReflectionCycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * EngineState — the single owner of everything that accumulates across calls.
 *
 * <ul>
 *   <li>Λ_total and its history (starts with the initial value)</li>
 *   <li>append-only reflection cycle and emergence histories</li>
 *   <li>the improvement log and the reflection baselines</li>
 *   <li>the reasoning cache</li>
 * </ul>
 *
 * <p>All history access goes through one reentrant lock; {@link #locked(Supplier)} lets a reflection
 * cycle hold it end to end. The reasoning cache is separately thread-safe and last-write-wins.</p>
 */
public final class EngineState {

    private static final Logger log = LoggerFactory.getLogger(EngineState.class);

    private final ReentrantLock lock = new ReentrantLock();

    private double lambdaTotal;
    private final ArrayList<Double> lambdaHistory = new ArrayList<>();
    private final ArrayList<ReflectionCycle> cycles = new ArrayList<>();
    private final ArrayList<Double> emergenceHistory = new ArrayList<>();
    private final ArrayList<ImprovementLogEntry> improvementLog = new ArrayList<>();
    private ReflectionBaselines baselines;
    /** Cycles completed in earlier runs, restored from a snapshot. */
    private int restoredCycles;

    private final int cacheCapacity;
    private final Map<ReasoningCacheKey, ReasoningResult> reasoningCache;

    public EngineState() {
        this(10.0, new ReflectionBaselines(), 0);
    }

    /**
     * @param cacheCapacity maximum cached reasoning results; 0 means unbounded
     */
    public EngineState(double initialLambda, ReflectionBaselines baselines, int cacheCapacity) {
        if (!Double.isFinite(initialLambda) || initialLambda < 0.0) {
            throw new IllegalArgumentException("initialLambda must be finite and >= 0: " + initialLambda);
        }
        if (cacheCapacity < 0) throw new IllegalArgumentException("cacheCapacity must be >= 0: " + cacheCapacity);
        this.lambdaTotal = initialLambda;
        this.lambdaHistory.add(initialLambda);
        this.baselines = Objects.requireNonNull(baselines, "baselines");
        this.cacheCapacity = cacheCapacity;
        final int cap = cacheCapacity;
        this.reasoningCache = (cap == 0)
                ? new ConcurrentHashMap<>()
                : Collections.synchronizedMap(new LinkedHashMap<>(Math.min(cap, 1024), 0.75f, true) {
                    @Override
                    protected boolean removeEldestEntry(Map.Entry<ReasoningCacheKey, ReasoningResult> eldest) {
                        return size() > cap;
                    }
                });
    }

    // =========================
    // Locking
    // =========================

    /** Runs {@code action} holding the state lock. Reentrant. */
    public <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    // =========================
    // Λ and histories
    // =========================

    public double lambdaTotal() {
        return locked(() -> lambdaTotal);
    }

    public List<Double> lambdaHistory() {
        return locked(() -> List.copyOf(lambdaHistory));
    }

    public List<Double> emergenceHistory() {
        return locked(() -> List.copyOf(emergenceHistory));
    }

    public List<ReflectionCycle> cycles() {
        return locked(() -> List.copyOf(cycles));
    }

    public Optional<ReflectionCycle> lastCycle() {
        lock.lock();
        try {
            if (cycles.isEmpty()) return Optional.empty();
            return Optional.of(cycles.get(cycles.size() - 1));
        } finally {
            lock.unlock();
        }
    }

    /** Cycles restored from a snapshot plus cycles run by this process. */
    public int cyclesCompleted() {
        return locked(() -> restoredCycles + cycles.size());
    }

    /**
     * Mean of the last {@code window} emergence samples, or 0 if fewer than {@code window} exist.
     */
    public double recentEmergenceMean(int window) {
        return locked(() -> {
            int n = emergenceHistory.size();
            if (window <= 0 || n < window) return 0.0;
            double sum = 0.0;
            for (int i = n - window; i < n; i++) sum += emergenceHistory.get(i);
            return sum / window;
        });
    }

    /**
     * Appends a finished cycle and adds its Λ impact.
     *
     * @return Λ_total after the append
     * @throws IllegalArgumentException if the impact is negative or not finite
     */
    public double appendCycle(ReflectionCycle cycle) {
        Objects.requireNonNull(cycle, "cycle");
        if (!Double.isFinite(cycle.lambdaImpact) || cycle.lambdaImpact < 0.0) {
            throw new IllegalArgumentException("Λ impact must be finite and >= 0: " + cycle.lambdaImpact);
        }
        return locked(() -> {
            lambdaTotal += cycle.lambdaImpact;
            lambdaHistory.add(lambdaTotal);
            emergenceHistory.add(cycle.emergence);
            cycles.add(cycle);
            return lambdaTotal;
        });
    }

    // =========================
    // Improvements
    // =========================

    public void logImprovement(ImprovementLogEntry entry) {
        Objects.requireNonNull(entry, "entry");
        locked(() -> improvementLog.add(entry));
    }

    public List<ImprovementLogEntry> improvementLog() {
        return locked(() -> List.copyOf(improvementLog));
    }

    /** Live baselines; mutate only while holding the lock. */
    public ReflectionBaselines baselines() {
        return locked(() -> baselines);
    }

    // =========================
    // Reasoning cache
    // =========================

    public Optional<ReasoningResult> cachedReasoning(ReasoningCacheKey key) {
        return Optional.ofNullable(reasoningCache.get(key));
    }

    public void cacheReasoning(ReasoningCacheKey key, ReasoningResult result) {
        reasoningCache.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(result, "result"));
    }

    /** @return number of dropped entries */
    public int clearReasoningCache() {
        synchronized (reasoningCache) {
            int n = reasoningCache.size();
            reasoningCache.clear();
            return n;
        }
    }

    public int reasoningCacheSize() {
        return reasoningCache.size();
    }

    public int cacheCapacity() {
        return cacheCapacity;
    }

    // =========================
    // Snapshots
    // =========================

    public EngineSnapshot snapshot(long nowEpochMs) {
        return locked(() -> {
            EngineSnapshot s = new EngineSnapshot();
            s.lambdaTotal = lambdaTotal;
            s.lambdaHistory = new ArrayList<>(lambdaHistory);
            s.emergenceHistory = new ArrayList<>(emergenceHistory);
            s.cyclesCompleted = restoredCycles + cycles.size();
            s.baselines = baselines.copy();
            s.savedAtEpochMs = nowEpochMs;
            return s;
        });
    }

    /**
     * Replaces Λ, the numeric histories and the baselines with a snapshot's values. Only allowed on a
     * state that has not run a cycle yet; cycle records themselves are not part of snapshots.
     */
    public void restore(EngineSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        snapshot.validate();
        locked(() -> {
            if (!cycles.isEmpty()) {
                throw new IllegalStateException("restore requires a fresh state, cycles=" + cycles.size());
            }
            lambdaTotal = snapshot.lambdaTotal;
            lambdaHistory.clear();
            lambdaHistory.addAll(snapshot.lambdaHistory);
            if (lambdaHistory.isEmpty()) lambdaHistory.add(lambdaTotal);
            emergenceHistory.clear();
            emergenceHistory.addAll(snapshot.emergenceHistory);
            restoredCycles = snapshot.cyclesCompleted;
            baselines = snapshot.baselines.copy();
            return null;
        });
        log.info("Engine state restored: Λ={} cycles={} emergenceSamples={}",
                snapshot.lambdaTotal, snapshot.cyclesCompleted, snapshot.emergenceHistory.size());
    }
}
