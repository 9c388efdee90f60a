package com.aura.backend.exception;

import com.aura.backend.model.FailureReason;

public class ExecutionFailedException extends RuntimeException {
    private final FailureReason reason;

    public ExecutionFailedException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ExecutionFailedException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public FailureReason getReason() {
        return reason;
    }
}
