package com.aura.backend.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public record CustomerRecord(String customerId, Map<String, String> features) {

    public CustomerRecord {
        features = Collections.unmodifiableMap(new LinkedHashMap<>(features));
    }

    /**
     * First non-blank value among the given column names, matched case-insensitively.
     */
    public Optional<String> text(String... columns) {
        for (String column : columns) {
            for (Map.Entry<String, String> entry : features.entrySet()) {
                if (entry.getKey().equalsIgnoreCase(column) && entry.getValue() != null && !entry.getValue().isBlank()) {
                    return Optional.of(entry.getValue().trim());
                }
            }
        }
        return Optional.empty();
    }

    public Optional<Double> numeric(String... columns) {
        return text(columns).flatMap(CustomerRecord::parseDouble);
    }

    public Optional<String> lowerText(String... columns) {
        return text(columns).map(value -> value.toLowerCase(Locale.ROOT));
    }

    private static Optional<Double> parseDouble(String value) {
        try {
            double parsed = Double.parseDouble(value);
            return Double.isFinite(parsed) ? Optional.of(parsed) : Optional.empty();
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
