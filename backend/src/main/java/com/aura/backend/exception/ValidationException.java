package com.aura.backend.exception;

import com.aura.backend.dto.ApiErrorDetail;

import java.util.List;

public class ValidationException extends RuntimeException {
    private final List<ApiErrorDetail> details;

    public ValidationException(String message) {
        this(message, List.of());
    }

    public ValidationException(String message, List<ApiErrorDetail> details) {
        super(message);
        this.details = List.copyOf(details);
    }

    public List<ApiErrorDetail> getDetails() {
        return details;
    }
}
