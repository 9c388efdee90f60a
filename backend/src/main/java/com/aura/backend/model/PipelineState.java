package com.aura.backend.model;

public enum PipelineState {
    IDLE,
    VALIDATING,
    EXECUTING,
    READING,
    SIMULATING,
    CACHED,
    FAILED
}
