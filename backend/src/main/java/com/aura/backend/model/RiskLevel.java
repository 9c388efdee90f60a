package com.aura.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RiskLevel {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    public static final double MEDIUM_THRESHOLD = 0.3;
    public static final double HIGH_THRESHOLD = 0.7;

    private final String label;

    RiskLevel(String label) {
        this.label = label;
    }

    /**
     * Buckets a churn probability: below 0.3 is Low, 0.3 to 0.7 inclusive is Medium, above 0.7 is High.
     */
    public static RiskLevel fromProbability(double probability) {
        if (probability < MEDIUM_THRESHOLD) {
            return LOW;
        }
        if (probability > HIGH_THRESHOLD) {
            return HIGH;
        }
        return MEDIUM;
    }

    @JsonCreator
    public static RiskLevel fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Risk level is blank");
        }
        return RiskLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
