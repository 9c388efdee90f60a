package com.aura.backend.model;

/**
 * Published batch of one run plus, when the simulator stood in for the scoring process, why it did.
 */
public record RunOutcome(long runId, PredictionBatch batch, FailureReason fallbackReason, String fallbackDetail) {

    public boolean isFallback() {
        return fallbackReason != null;
    }
}
