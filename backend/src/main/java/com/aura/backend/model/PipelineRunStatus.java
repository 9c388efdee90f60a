package com.aura.backend.model;

import java.time.Instant;

public record PipelineRunStatus(
        Long runId,
        PipelineState state,
        PredictionSource source,
        Instant startedAt,
        Instant completedAt,
        FailureReason failureReason,
        String message
) {

    public static PipelineRunStatus idle() {
        return new PipelineRunStatus(null, PipelineState.IDLE, null, null, null, null, null);
    }

    public PipelineRunStatus withState(PipelineState newState) {
        return new PipelineRunStatus(runId, newState, source, startedAt, completedAt, failureReason, message);
    }
}
