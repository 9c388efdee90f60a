package com.aura.backend.service.scoring;

import com.aura.backend.config.PipelineProperties;
import com.aura.backend.model.CustomerRecord;
import com.aura.backend.model.PipelineState;
import com.aura.backend.model.PredictionBatch;
import com.aura.backend.model.PredictionRecord;
import com.aura.backend.model.PredictionSource;
import com.aura.backend.model.ValidatedTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Heuristic stand-in for the scoring process, used as automatic fallback and for demo runs.
 *
 * <p>Starting from a base of 0.2 the estimate rises for short tenure, high monthly charges and
 * month-to-month contracts, and falls for long tenure, low charges and two-year contracts. Records without
 * any of those columns start from a Beta(2,5) draw instead. A small seeded jitter is added and the result is
 * clipped to [0,1], so the same table always simulates to the same batch.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SimulatedScorer implements Scorer {

    static final double BASE_PROBABILITY = 0.2;

    private static final String[] TENURE_COLUMNS = {"tenure", "tenure_months"};
    private static final String[] CHARGE_COLUMNS = {"MonthlyCharges", "monthly_charges", "monthly_charge", "mrr_current"};
    private static final String[] CONTRACT_COLUMNS = {"Contract", "contract_type", "subscription_plan"};

    private final PipelineProperties properties;
    private final Clock clock;

    @Override
    public PredictionSource source() {
        return PredictionSource.SIMULATED;
    }

    @Override
    public PredictionBatch score(ValidatedTable table, Progress progress) {
        progress.onStateChange(PipelineState.SIMULATING);
        return simulate(table);
    }

    public PredictionBatch simulate(ValidatedTable table) {
        PipelineProperties.Simulation simulation = properties.getSimulation();
        Random random = new Random(simulation.getSeed());
        List<PredictionRecord> records = new ArrayList<>(table.size());
        for (CustomerRecord customer : table.records()) {
            double estimate = heuristic(customer).orElseGet(() -> beta25(random));
            double jitter = (random.nextDouble() * 2.0 - 1.0) * simulation.getJitter();
            records.add(PredictionRecord.of(customer.customerId(), round(clip(estimate + jitter))));
        }
        log.info("Simulated {} predictions", records.size());
        return PredictionBatch.of(records, PredictionSource.SIMULATED, Instant.now(clock));
    }

    /**
     * Feature-driven estimate before jitter, or empty when the record carries none of the known columns.
     */
    static Optional<Double> heuristic(CustomerRecord customer) {
        Optional<Double> tenure = customer.numeric(TENURE_COLUMNS);
        Optional<Double> charge = customer.numeric(CHARGE_COLUMNS);
        Optional<String> contract = customer.lowerText(CONTRACT_COLUMNS);
        if (tenure.isEmpty() && charge.isEmpty() && contract.isEmpty()) {
            return Optional.empty();
        }
        double estimate = BASE_PROBABILITY;
        if (tenure.isPresent()) {
            double months = tenure.get();
            if (months < 12) {
                estimate += 0.25;
            } else if (months < 24) {
                estimate += 0.10;
            } else if (months >= 48) {
                estimate -= 0.10;
            }
        }
        if (charge.isPresent()) {
            double monthly = charge.get();
            if (monthly > 80) {
                estimate += 0.20;
            } else if (monthly > 60) {
                estimate += 0.10;
            } else if (monthly < 30) {
                estimate -= 0.05;
            }
        }
        if (contract.isPresent()) {
            String value = contract.get();
            if (value.startsWith("month")) {
                estimate += 0.25;
            } else if (value.contains("two") || value.startsWith("2")) {
                estimate -= 0.10;
            } else if (value.contains("one") || value.startsWith("1")) {
                estimate += 0.05;
            }
        }
        return Optional.of(estimate);
    }

    // Second smallest of six uniforms is Beta(2,5) distributed
    private static double beta25(Random random) {
        double[] draws = new double[6];
        for (int i = 0; i < draws.length; i++) {
            draws[i] = random.nextDouble();
        }
        Arrays.sort(draws);
        return draws[1];
    }

    private static double clip(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
