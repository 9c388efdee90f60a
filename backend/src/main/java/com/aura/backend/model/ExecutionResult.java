package com.aura.backend.model;

import com.aura.backend.service.scoring.OutputHandle;

/**
 * Outcome of one external scoring invocation: either a handle to the produced artifact or a failure reason.
 */
public record ExecutionResult(OutputHandle output, FailureReason failureReason, String detail) {

    public static ExecutionResult success(OutputHandle output) {
        return new ExecutionResult(output, null, null);
    }

    public static ExecutionResult failure(FailureReason reason, String detail) {
        return new ExecutionResult(null, reason, detail);
    }

    public boolean isSuccess() {
        return failureReason == null;
    }
}
