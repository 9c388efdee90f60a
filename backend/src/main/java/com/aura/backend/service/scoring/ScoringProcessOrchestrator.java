package com.aura.backend.service.scoring;

import com.aura.backend.config.PipelineProperties;
import com.aura.backend.exception.ExecutionFailedException;
import com.aura.backend.exception.PipelineBusyException;
import com.aura.backend.model.ExecutionResult;
import com.aura.backend.model.FailureReason;
import com.aura.backend.model.ValidatedTable;
import io.github.resilience4j.bulkhead.Bulkhead;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Owns the hand-off to the external scoring process. At most one process runs at a time; a second caller is
 * rejected with {@link PipelineBusyException} instead of queueing. The permit covers the whole exchange, from
 * publishing the input to consuming the artifact. Every other outcome, including timeouts and caller
 * interruption, is reported as an {@link ExecutionResult}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScoringProcessOrchestrator {

    private static final long REAP_TIMEOUT_SECONDS = 5;

    private final ExchangeChannel exchangeChannel;
    private final PipelineProperties properties;
    private final Bulkhead scoringBulkhead;

    public ExecutionResult run(ValidatedTable table, Duration timeout) {
        return run(table, timeout, () -> { });
    }

    /**
     * Same as {@link #run(ValidatedTable, Duration)}; {@code onAdmitted} runs once the exclusive permit is held.
     */
    public ExecutionResult run(ValidatedTable table, Duration timeout, Runnable onAdmitted) {
        acquire();
        try {
            onAdmitted.run();
            return execute(table, timeout);
        } finally {
            scoringBulkhead.onComplete();
        }
    }

    /**
     * Runs the process and hands its artifact to {@code processor} before the permit is released, so no other
     * run can reset or rewrite the artifact while it is being consumed.
     *
     * @throws ExecutionFailedException when the process did not produce an artifact
     */
    public <T> T runAndCollect(ValidatedTable table, Duration timeout, Runnable onAdmitted, OutputProcessor<T> processor) {
        acquire();
        try {
            onAdmitted.run();
            ExecutionResult result = execute(table, timeout);
            if (!result.isSuccess()) {
                throw new ExecutionFailedException(result.failureReason(), result.detail());
            }
            return processor.process(result.output());
        } finally {
            scoringBulkhead.onComplete();
        }
    }

    public boolean isAvailable() {
        Path workingDirectory = exchangeChannel.workingDirectory();
        if (!Files.isDirectory(workingDirectory)) {
            return false;
        }
        return properties.getScorer().getRequiredFiles().stream()
                .allMatch(file -> Files.exists(workingDirectory.resolve(file)));
    }

    public boolean isBusy() {
        return scoringBulkhead.getMetrics().getAvailableConcurrentCalls() == 0;
    }

    private void acquire() {
        if (!scoringBulkhead.tryAcquirePermission()) {
            throw new PipelineBusyException("A scoring run is already in progress", properties.getScorer().getRetryAfter());
        }
    }

    // Writing the input and waiting for the process share one deadline
    private ExecutionResult execute(ValidatedTable table, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        if (!isAvailable()) {
            return failure(FailureReason.UNAVAILABLE, "Scoring process files not found in " + exchangeChannel.workingDirectory());
        }
        try {
            exchangeChannel.resetOutput();
            exchangeChannel.publishInput(table);
        } catch (ClosedByInterruptException ex) {
            Thread.currentThread().interrupt();
            return failure(FailureReason.CANCELLED, "Scoring run was cancelled while writing input");
        } catch (IOException ex) {
            return failure(FailureReason.CRASH, "Could not write scoring input: " + ex.getMessage());
        }
        long remainingNanos = deadline - System.nanoTime();
        if (remainingNanos <= 0) {
            return failure(FailureReason.TIMEOUT, "Writing scoring input took longer than " + timeout);
        }

        Process process;
        try {
            process = start();
        } catch (IOException ex) {
            return failure(FailureReason.CRASH, "Could not start scoring process: " + ex.getMessage());
        }
        log.info("Scoring process pid={} started for {} customers (timeout {})", process.pid(), table.size(), timeout);

        try {
            if (!process.waitFor(remainingNanos, TimeUnit.NANOSECONDS)) {
                terminate(process);
                return failure(FailureReason.TIMEOUT, "Scoring process did not finish within " + timeout);
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                return failure(FailureReason.CRASH, "Scoring process exited with code " + exitCode);
            }
            Optional<OutputHandle> output = exchangeChannel.collectOutput();
            if (output.isEmpty()) {
                return failure(FailureReason.MISSING_OUTPUT, "Scoring process finished without producing output");
            }
            log.info("Scoring process pid={} completed, output at {}", process.pid(), output.get().location());
            return ExecutionResult.success(output.get());
        } catch (InterruptedException ex) {
            terminate(process);
            Thread.currentThread().interrupt();
            return failure(FailureReason.CANCELLED, "Scoring run was cancelled");
        } catch (IOException ex) {
            return failure(FailureReason.CRASH, "Could not collect scoring output: " + ex.getMessage());
        } finally {
            if (process.isAlive()) {
                terminate(process);
            }
        }
    }

    @FunctionalInterface
    public interface OutputProcessor<T> {
        T process(OutputHandle output);
    }

    private Process start() throws IOException {
        PipelineProperties.Scorer scorer = properties.getScorer();
        Path workingDirectory = exchangeChannel.workingDirectory();
        ProcessBuilder builder = new ProcessBuilder(scorer.getCommand())
                .directory(workingDirectory.toFile())
                .redirectErrorStream(true);
        if (scorer.getLogFile() == null || scorer.getLogFile().isBlank()) {
            builder.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        } else {
            builder.redirectOutput(workingDirectory.resolve(scorer.getLogFile()).toFile());
        }
        return builder.start();
    }

    private void terminate(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(REAP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Scoring process pid={} still alive after forced termination", process.pid());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private ExecutionResult failure(FailureReason reason, String detail) {
        log.warn("Scoring execution failed: {} ({})", reason, detail);
        return ExecutionResult.failure(reason, detail);
    }
}
