package com.aura.backend.model;

public record PredictionRecord(String customerId, double churnProbability, RiskLevel riskLevel) {

    public PredictionRecord {
        if (customerId == null || customerId.isBlank()) {
            throw new IllegalArgumentException("customerId is required");
        }
        if (Double.isNaN(churnProbability) || churnProbability < 0.0 || churnProbability > 1.0) {
            throw new IllegalArgumentException("churnProbability out of range [0,1]: " + churnProbability);
        }
        if (riskLevel != RiskLevel.fromProbability(churnProbability)) {
            throw new IllegalArgumentException("riskLevel " + riskLevel + " does not match probability " + churnProbability);
        }
    }

    public static PredictionRecord of(String customerId, double churnProbability) {
        return new PredictionRecord(customerId, churnProbability, RiskLevel.fromProbability(churnProbability));
    }
}
