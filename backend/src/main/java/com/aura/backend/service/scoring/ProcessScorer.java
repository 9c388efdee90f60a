package com.aura.backend.service.scoring;

import com.aura.backend.config.PipelineProperties;
import com.aura.backend.exception.ExecutionFailedException;
import com.aura.backend.exception.ValidationException;
import com.aura.backend.model.FailureReason;
import com.aura.backend.model.PipelineState;
import com.aura.backend.model.PredictionBatch;
import com.aura.backend.model.PredictionSource;
import com.aura.backend.model.ValidatedTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
@RequiredArgsConstructor
@Slf4j
public class ProcessScorer implements Scorer {

    private final ScoringProcessOrchestrator orchestrator;
    private final PredictionOutputReader outputReader;
    private final PipelineProperties properties;

    @Override
    public PredictionSource source() {
        return PredictionSource.MODEL;
    }

    @Override
    public PredictionBatch score(ValidatedTable table, Progress progress) {
        return orchestrator.runAndCollect(table, properties.getScorer().getTimeout(),
                () -> progress.onStateChange(PipelineState.EXECUTING),
                output -> {
                    progress.onStateChange(PipelineState.READING);
                    return readOutput(output, table);
                });
    }

    private PredictionBatch readOutput(OutputHandle output, ValidatedTable table) {
        try {
            return outputReader.read(output, table.customerIds());
        } catch (ValidationException ex) {
            log.warn("Rejected scoring output: {} {}", ex.getMessage(), ex.getDetails());
            throw new ExecutionFailedException(FailureReason.MALFORMED_OUTPUT, ex.getMessage(), ex);
        } catch (IOException ex) {
            throw new ExecutionFailedException(FailureReason.MALFORMED_OUTPUT, "Could not read scoring output: " + ex.getMessage(), ex);
        }
    }
}
