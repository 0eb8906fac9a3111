package org.calista.r3.reflect;

import java.util.Objects;

/**
 * Outcome of applying one proposal: the handler result, or the error it raised.
 */
public final class ImprovementLogEntry {

    public final String cycleId;
    public final ImprovementKind kind;
    public final boolean success;
    public final String result;
    public final String error;
    public final long timestampEpochMs;

    public ImprovementLogEntry(String cycleId, ImprovementKind kind, boolean success,
                               String result, String error, long timestampEpochMs) {
        this.cycleId = Objects.requireNonNull(cycleId, "cycleId");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.success = success;
        this.result = result;
        this.error = error;
        this.timestampEpochMs = timestampEpochMs;
    }

    public static ImprovementLogEntry success(String cycleId, ImprovementKind kind, String result, long ts) {
        return new ImprovementLogEntry(cycleId, kind, true, result, null, ts);
    }

    public static ImprovementLogEntry failure(String cycleId, ImprovementKind kind, Throwable error, long ts) {
        return new ImprovementLogEntry(cycleId, kind, false, null, String.valueOf(error), ts);
    }

    @Override
    public String toString() {
        return kind.id + (success ? " ok: " + result : " failed: " + error);
    }
}
