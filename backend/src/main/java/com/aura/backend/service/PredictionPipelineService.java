package com.aura.backend.service;

import com.aura.backend.config.PipelineProperties;
import com.aura.backend.exception.ExecutionFailedException;
import com.aura.backend.exception.PipelineBusyException;
import com.aura.backend.exception.ValidationException;
import com.aura.backend.model.FailureReason;
import com.aura.backend.model.PipelineRunStatus;
import com.aura.backend.model.PipelineState;
import com.aura.backend.model.PredictionBatch;
import com.aura.backend.model.RawTable;
import com.aura.backend.model.RunMode;
import com.aura.backend.model.RunOutcome;
import com.aura.backend.model.ValidatedTable;
import com.aura.backend.service.scoring.ProcessScorer;
import com.aura.backend.service.scoring.Scorer;
import com.aura.backend.service.scoring.SimulatedScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives one run through Validating, Executing, Reading or Simulating and Cached. An execution failure switches
 * to the simulator unless fallback is disabled, in which case the run ends in FAILED and the reason is
 * surfaced. A cancelled run never falls back and never publishes a batch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PredictionPipelineService {

    private final CsvTableCodec csvTableCodec;
    private final IngestionValidator ingestionValidator;
    private final UploadedTableStore uploadedTableStore;
    private final ProcessScorer processScorer;
    private final SimulatedScorer simulatedScorer;
    private final PredictionResultStore resultStore;
    private final PipelineMetricsService metricsService;
    private final PipelineProperties properties;
    private final Clock clock;

    private final AtomicLong runIds = new AtomicLong();
    private final AtomicReference<PipelineRunStatus> lastRun = new AtomicReference<>(PipelineRunStatus.idle());

    public ValidatedTable validate(InputStream input) throws IOException {
        RawTable raw = csvTableCodec.read(input);
        ValidatedTable table = ingestionValidator.validate(raw);
        if (!table.warnings().isEmpty()) {
            log.info("Validated {} customers with warnings: {}", table.size(), table.warnings());
        }
        return table;
    }

    public ValidatedTable upload(InputStream input) throws IOException {
        ValidatedTable table = validate(input);
        uploadedTableStore.stage(table);
        log.info("✅ Data uploaded: {} customers, {} columns", table.size(), table.columns().size());
        return table;
    }

    public RunOutcome runStaged(RunMode mode) {
        ValidatedTable table = uploadedTableStore.getStaged()
                .orElseThrow(() -> new ValidationException("No customer data uploaded. Upload a file or attach one to the run request."));
        return run(table, mode);
    }

    /**
     * Validates {@code input} as part of the run, so the run reports VALIDATING first. A table that fails
     * validation leaves the previous status in place.
     */
    public RunOutcome run(InputStream input, RunMode mode) throws IOException {
        long runId = runIds.incrementAndGet();
        Instant startedAt = clock.instant();
        PipelineRunStatus before = lastRun.get();
        MDC.put("runId", String.valueOf(runId));
        try {
            transition(runId, PipelineState.VALIDATING, startedAt);
            ValidatedTable table;
            try {
                table = validate(input);
            } catch (ValidationException | IOException ex) {
                restore(runId, before);
                log.info("Run {} rejected: {}", runId, ex.getMessage());
                throw ex;
            }
            return execute(runId, startedAt, before, table, mode);
        } finally {
            MDC.remove("runId");
        }
    }

    public RunOutcome run(ValidatedTable table, RunMode mode) {
        long runId = runIds.incrementAndGet();
        Instant startedAt = clock.instant();
        PipelineRunStatus before = lastRun.get();
        MDC.put("runId", String.valueOf(runId));
        try {
            return execute(runId, startedAt, before, table, mode);
        } finally {
            MDC.remove("runId");
        }
    }

    public Optional<PredictionBatch> currentBatch() {
        return resultStore.getCurrent();
    }

    public PipelineRunStatus status() {
        return lastRun.get();
    }

    private RunOutcome execute(long runId, Instant startedAt, PipelineRunStatus before, ValidatedTable table, RunMode mode) {
        log.info("RUN START: runId={} mode={} customers={}", runId, mode, table.size());
        Scorer.Progress progress = state -> transition(runId, state, startedAt);
        try {
            FailureReason fallbackReason = null;
            String fallbackDetail = null;
            PredictionBatch batch;
            if (mode == RunMode.DEMO) {
                batch = simulatedScorer.score(table, progress);
            } else {
                try {
                    batch = processScorer.score(table, progress);
                } catch (ExecutionFailedException ex) {
                    if (ex.getReason() == FailureReason.CANCELLED || !properties.isFallbackEnabled()) {
                        fail(runId, startedAt, ex);
                        throw ex;
                    }
                    log.warn("🔄 Scoring failed ({}: {}), falling back to simulation", ex.getReason(), ex.getMessage());
                    metricsService.recordFallback(ex.getReason());
                    fallbackReason = ex.getReason();
                    fallbackDetail = ex.getMessage();
                    batch = simulatedScorer.score(table, progress);
                }
            }

            PredictionBatch published = resultStore.set(batch);
            transition(runId, PipelineState.CACHED, startedAt);
            Instant completedAt = clock.instant();
            lastRun.set(new PipelineRunStatus(runId, PipelineState.IDLE, published.source(), startedAt, completedAt,
                    fallbackReason, fallbackDetail));
            metricsService.recordRun(published.source(), Duration.between(startedAt, completedAt));
            log.info("✅ RUN COMPLETE: runId={} source={} version={} summary={}", runId, published.source().getTag(),
                    published.version(), published.summary());
            return new RunOutcome(runId, published, fallbackReason, fallbackDetail);
        } catch (PipelineBusyException ex) {
            restore(runId, before);
            metricsService.recordBusyRejection();
            log.info("Run {} rejected: {}", runId, ex.getMessage());
            throw ex;
        }
    }

    private void transition(long runId, PipelineState state, Instant startedAt) {
        log.debug("Run {} -> {}", runId, state);
        lastRun.updateAndGet(previous -> Objects.equals(previous.runId(), runId)
                ? previous.withState(state)
                : new PipelineRunStatus(runId, state, null, startedAt, null, null, null));
    }

    // A rejected run leaves no trace in the status, unless another run has already replaced it
    private void restore(long runId, PipelineRunStatus before) {
        lastRun.updateAndGet(current -> Objects.equals(current.runId(), runId) ? before : current);
    }

    private void fail(long runId, Instant startedAt, ExecutionFailedException ex) {
        metricsService.recordFailure(ex.getReason());
        lastRun.set(new PipelineRunStatus(runId, PipelineState.FAILED, null, startedAt, clock.instant(),
                ex.getReason(), ex.getMessage()));
        log.error("❌ RUN FAILED: runId={} reason={} ({})", runId, ex.getReason(), ex.getMessage());
    }
}
