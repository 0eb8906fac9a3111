package org.calista.r3.service;

import org.calista.r3.reflect.CycleMetrics;

import java.util.Objects;

/**
 * Everything {@link R3System#process} produced for one query.
 */
public final class PipelineResult {

    public final String sessionId;
    public final ReasoningPath path;
    public final CycleMetrics cycleMetrics;
    public final RequirementsReport validation;
    public final R3System.SessionMetrics session;

    public PipelineResult(String sessionId,
                          ReasoningPath path,
                          CycleMetrics cycleMetrics,
                          RequirementsReport validation,
                          R3System.SessionMetrics session) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.path = Objects.requireNonNull(path, "path");
        this.cycleMetrics = Objects.requireNonNull(cycleMetrics, "cycleMetrics");
        this.validation = Objects.requireNonNull(validation, "validation");
        this.session = Objects.requireNonNull(session, "session");
    }
}
