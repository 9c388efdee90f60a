package com.aura.backend.model;

import java.util.Locale;

public enum RunMode {
    // external scoring process, simulator only on failure
    MODEL,
    // simulator only
    DEMO;

    public static RunMode fromParameter(String value) {
        if (value == null || value.isBlank()) {
            return MODEL;
        }
        return RunMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
