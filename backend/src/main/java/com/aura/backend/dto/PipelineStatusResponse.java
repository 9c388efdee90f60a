package com.aura.backend.dto;

import com.aura.backend.model.FailureReason;
import com.aura.backend.model.PipelineState;
import com.aura.backend.model.PredictionSource;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PipelineStatusResponse {
    private Long runId;
    private PipelineState state;
    private PredictionSource source;
    private Instant startedAt;
    private Instant completedAt;
    private FailureReason failureReason;
    private String message;
    private long currentVersion;
}
