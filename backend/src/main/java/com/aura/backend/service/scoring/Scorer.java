package com.aura.backend.service.scoring;

import com.aura.backend.exception.ExecutionFailedException;
import com.aura.backend.model.PipelineState;
import com.aura.backend.model.PredictionBatch;
import com.aura.backend.model.PredictionSource;
import com.aura.backend.model.ValidatedTable;

/**
 * Turns a validated table into a batch holding exactly one prediction per input identifier.
 */
public interface Scorer {

    PredictionSource source();

    /**
     * @throws ExecutionFailedException when no batch could be produced
     */
    PredictionBatch score(ValidatedTable table, Progress progress);

    default PredictionBatch score(ValidatedTable table) {
        return score(table, state -> { });
    }

    @FunctionalInterface
    interface Progress {
        void onStateChange(PipelineState state);
    }
}
