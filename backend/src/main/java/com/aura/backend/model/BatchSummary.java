package com.aura.backend.model;

import java.util.List;

public record BatchSummary(int total, int low, int medium, int high, double meanProbability) {

    public static BatchSummary of(List<PredictionRecord> records) {
        int low = 0;
        int medium = 0;
        int high = 0;
        double sum = 0.0;
        for (PredictionRecord record : records) {
            switch (record.riskLevel()) {
                case LOW -> low++;
                case MEDIUM -> medium++;
                case HIGH -> high++;
            }
            sum += record.churnProbability();
        }
        double mean = records.isEmpty() ? 0.0 : sum / records.size();
        return new BatchSummary(records.size(), low, medium, high, mean);
    }
}
