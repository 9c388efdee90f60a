package com.aura.backend.dto;

import com.aura.backend.model.BatchSummary;
import com.aura.backend.model.FailureReason;
import com.aura.backend.model.PredictionBatch;
import com.aura.backend.model.PredictionRecord;
import com.aura.backend.model.PredictionSource;
import com.aura.backend.model.RunOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchResponse {
    private Long runId;
    private long version;
    private PredictionSource source;
    private boolean simulated;
    private FailureReason fallbackReason;
    private String fallbackDetail;
    private Instant generatedAt;
    private BatchSummary summary;
    private List<PredictionRecord> predictions;

    public static BatchResponse from(PredictionBatch batch) {
        return BatchResponse.builder()
                .version(batch.version())
                .source(batch.source())
                .simulated(batch.source() == PredictionSource.SIMULATED)
                .generatedAt(batch.generatedAt())
                .summary(batch.summary())
                .predictions(batch.records())
                .build();
    }

    public static BatchResponse from(RunOutcome outcome) {
        BatchResponse response = from(outcome.batch());
        response.setRunId(outcome.runId());
        response.setFallbackReason(outcome.fallbackReason());
        response.setFallbackDetail(outcome.fallbackDetail());
        return response;
    }
}
