package com.aura.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PredictionSource {
    MODEL("model"),
    SIMULATED("simulated");

    private final String tag;

    PredictionSource(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }
}
