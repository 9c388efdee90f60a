package com.aura.backend.service;

import com.aura.backend.model.PredictionBatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the single current batch. Publishing swaps one immutable reference, so readers see either the old
 * or the new batch and the most recently published batch wins. Writers are serialized so versions follow
 * publish order; readers never block.
 */
@Component
@Slf4j
public class PredictionResultStore {

    private final AtomicReference<PredictionBatch> current = new AtomicReference<>();
    private final AtomicLong versions = new AtomicLong();

    public synchronized PredictionBatch set(PredictionBatch batch) {
        PredictionBatch published = batch.withVersion(versions.incrementAndGet());
        current.set(published);
        log.info("Published batch v{} ({} records, source={})", published.version(), published.records().size(),
                published.source().getTag());
        return published;
    }

    public Optional<PredictionBatch> getCurrent() {
        return Optional.ofNullable(current.get());
    }

    public long currentVersion() {
        PredictionBatch batch = current.get();
        return batch == null ? 0L : batch.version();
    }

    public synchronized void clear() {
        current.set(null);
    }
}
