package com.aura.backend.model;

public enum FailureReason {
    TIMEOUT,
    CRASH,
    MISSING_OUTPUT,
    MALFORMED_OUTPUT,
    // scorer prerequisites (working directory, model files) are missing
    UNAVAILABLE,
    CANCELLED
}
