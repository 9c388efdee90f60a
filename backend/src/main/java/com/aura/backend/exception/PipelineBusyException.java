package com.aura.backend.exception;

import java.time.Duration;

public class PipelineBusyException extends RuntimeException {
    private final Duration retryAfter;

    public PipelineBusyException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter;
    }

    public PipelineBusyException(String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.retryAfter = retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
