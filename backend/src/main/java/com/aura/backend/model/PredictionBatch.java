package com.aura.backend.model;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable result of one pipeline run. The version is assigned by the result store on publish
 * and is zero for a batch that has not been published yet.
 */
public record PredictionBatch(
        List<PredictionRecord> records,
        BatchSummary summary,
        PredictionSource source,
        Instant generatedAt,
        long version
) {

    public PredictionBatch {
        records = List.copyOf(records);
        if (summary.low() + summary.medium() + summary.high() != records.size() || summary.total() != records.size()) {
            throw new IllegalArgumentException("Risk level counts do not add up to batch size " + records.size());
        }
        Set<String> seen = new HashSet<>();
        for (PredictionRecord record : records) {
            if (!seen.add(record.customerId())) {
                throw new IllegalArgumentException("Duplicate customerId in batch: " + record.customerId());
            }
        }
    }

    public static PredictionBatch of(List<PredictionRecord> records, PredictionSource source, Instant generatedAt) {
        return new PredictionBatch(records, BatchSummary.of(records), source, generatedAt, 0L);
    }

    public PredictionBatch withVersion(long newVersion) {
        return new PredictionBatch(records, summary, source, generatedAt, newVersion);
    }

    public List<String> customerIds() {
        return records.stream().map(PredictionRecord::customerId).toList();
    }
}
