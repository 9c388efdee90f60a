package com.aura.backend.service.scoring;

import com.aura.backend.config.PipelineProperties;
import com.aura.backend.model.CustomerRecord;
import com.aura.backend.model.PipelineState;
import com.aura.backend.model.PredictionBatch;
import com.aura.backend.model.PredictionRecord;
import com.aura.backend.model.PredictionSource;
import com.aura.backend.model.RiskLevel;
import com.aura.backend.model.ValidatedTable;
import com.aura.backend.util.TestTables;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SimulatedScorerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

    @Test
    void everyInputIdAppearsExactlyOnceWithValidRiskLevel() {
        ValidatedTable table = TestTables.telco(250);

        PredictionBatch batch = new SimulatedScorer(new PipelineProperties(), clock).simulate(table);

        assertThat(batch.source()).isEqualTo(PredictionSource.SIMULATED);
        assertThat(batch.customerIds()).containsExactlyElementsOf(table.customerIds());
        for (PredictionRecord record : batch.records()) {
            assertThat(record.churnProbability()).isBetween(0.0, 1.0);
            assertThat(record.riskLevel()).isEqualTo(RiskLevel.fromProbability(record.churnProbability()));
        }
        assertThat(batch.summary().low() + batch.summary().medium() + batch.summary().high()).isEqualTo(250);
        assertThat(batch.generatedAt()).isEqualTo(clock.instant());
    }

    @Test
    void sameTableSimulatesToSameBatch() {
        SimulatedScorer scorer = new SimulatedScorer(new PipelineProperties(), clock);
        ValidatedTable table = TestTables.telco(40);

        assertThat(scorer.simulate(table).records()).isEqualTo(scorer.simulate(table).records());
    }

    @Test
    void riskierProfileScoresHigher() {
        CustomerRecord risky = new CustomerRecord("R", Map.of("tenure", "2", "MonthlyCharges", "95", "Contract", "Month-to-month"));
        CustomerRecord loyal = new CustomerRecord("L", Map.of("tenure", "60", "MonthlyCharges", "25", "Contract", "Two year"));

        assertThat(SimulatedScorer.heuristic(risky)).hasValueSatisfying(p -> assertThat(p).isCloseTo(0.9, within(1e-9)));
        assertThat(SimulatedScorer.heuristic(loyal)).hasValueSatisfying(p -> assertThat(p).isCloseTo(-0.05, within(1e-9)));
    }

    @Test
    void heuristicUsesAliasedColumns() {
        CustomerRecord record = new CustomerRecord("X", Map.of("tenure_months", "30", "mrr_current", "70", "contract_type", "one year"));

        assertThat(SimulatedScorer.heuristic(record)).hasValueSatisfying(p -> assertThat(p).isCloseTo(0.35, within(1e-9)));
    }

    @Test
    void recordsWithoutFeaturesStillGetBoundedProbabilities() {
        ValidatedTable table = TestTables.table(List.of("customerID", "name"), List.of("A", "x"), List.of("B", "y"), List.of("C", "z"));

        PredictionBatch batch = new SimulatedScorer(new PipelineProperties(), clock).simulate(table);

        assertThat(SimulatedScorer.heuristic(table.records().get(0))).isEmpty();
        assertThat(batch.records()).hasSize(3).allSatisfy(r -> assertThat(r.churnProbability()).isBetween(0.0, 1.0));
    }

    @Test
    void jitterStaysWithinConfiguredBound() {
        PipelineProperties properties = new PipelineProperties();
        properties.getSimulation().setJitter(0.02);
        ValidatedTable table = TestTables.table(List.of("customerID", "tenure", "MonthlyCharges", "Contract"),
                List.of("A", "30", "50", "One year"));

        PredictionBatch batch = new SimulatedScorer(properties, clock).simulate(table);

        assertThat(batch.records().get(0).churnProbability()).isBetween(0.23, 0.27);
    }

    @Test
    void reportsSimulatingState() {
        List<PipelineState> states = new ArrayList<>();

        new SimulatedScorer(new PipelineProperties(), clock).score(TestTables.telco(3), states::add);

        assertThat(states).containsExactly(PipelineState.SIMULATING);
    }
}
