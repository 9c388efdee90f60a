package com.aura.backend.service.scoring;

import com.aura.backend.config.PipelineProperties;
import com.aura.backend.config.ScoringConfig;
import com.aura.backend.exception.ExecutionFailedException;
import com.aura.backend.exception.PipelineBusyException;
import com.aura.backend.model.FailureReason;
import com.aura.backend.model.PipelineState;
import com.aura.backend.model.PredictionBatch;
import com.aura.backend.model.PredictionRecord;
import com.aura.backend.model.PredictionSource;
import com.aura.backend.model.RiskLevel;
import com.aura.backend.model.ValidatedTable;
import com.aura.backend.service.CsvTableCodec;
import com.aura.backend.util.TestTables;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import io.github.resilience4j.bulkhead.Bulkhead;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProcessScorerTest {

    private static final String ECHO_SCORER =
            "awk -F, 'NR==1{print \"customerID,churn_probability\"; next} {print $1\",\"$2}' customers.csv > predictions.csv";

    @TempDir
    Path workDir;

    private final Clock clock = Clock.systemUTC();
    private final CsvTableCodec codec = new CsvTableCodec(new CsvMapper());
    private final ValidatedTable table = TestTables.table(List.of("customerID", "score"),
            List.of("A", "0.1"), List.of("B", "0.5"), List.of("C", "0.9"));

    private PipelineProperties properties;
    private Bulkhead bulkhead;
    private ScoringProcessOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        properties.getScorer().setWorkingDirectory(workDir.toString());
        properties.getScorer().setRequiredFiles(List.of());
        properties.getScorer().setTimeout(Duration.ofSeconds(20));
        bulkhead = new ScoringConfig().scoringBulkhead();
        orchestrator = new ScoringProcessOrchestrator(
                new FileExchangeChannel(workDir, "customers.csv", "predictions.csv", codec), properties, bulkhead);
    }

    @Test
    void validArtifactBecomesModelBatch() {
        useScript(ECHO_SCORER);
        List<PipelineState> states = new ArrayList<>();

        PredictionBatch batch = scorer(new PredictionOutputReader(codec, properties, clock)).score(table, states::add);

        assertThat(batch.source()).isEqualTo(PredictionSource.MODEL);
        assertThat(batch.records()).extracting(PredictionRecord::riskLevel)
                .containsExactly(RiskLevel.LOW, RiskLevel.MEDIUM, RiskLevel.HIGH);
        assertThat(states).containsExactly(PipelineState.EXECUTING, PipelineState.READING);
        assertThat(bulkhead.getMetrics().getAvailableConcurrentCalls()).isEqualTo(1);
    }

    @Test
    void probabilityOutsideUnitIntervalIsMalformed() {
        useScript("printf 'customerID,churn_probability\\nA,0.1\\nB,1.7\\nC,0.9\\n' > predictions.csv");

        assertFailure(FailureReason.MALFORMED_OUTPUT);
    }

    @Test
    void unexpectedIdentifierIsMalformed() {
        useScript("printf 'customerID,churn_probability\\nA,0.1\\nB,0.5\\nC,0.9\\nZ,0.3\\n' > predictions.csv");

        assertFailure(FailureReason.MALFORMED_OUTPUT);
    }

    @Test
    void missingArtifactIsReportedAsMissingOutput() {
        useScript("exit 0");

        assertFailure(FailureReason.MISSING_OUTPUT);
    }

    @Test
    void slowProcessIsReportedAsTimeout() {
        properties.getScorer().setTimeout(Duration.ofMillis(300));
        useScript("sleep 30");

        assertFailure(FailureReason.TIMEOUT);
        assertThat(bulkhead.getMetrics().getAvailableConcurrentCalls()).isEqualTo(1);
    }

    @Test
    void unreadableArtifactIsMalformed() {
        useScript(ECHO_SCORER);
        PredictionOutputReader failingReader = new PredictionOutputReader(codec, properties, clock) {
            @Override
            public PredictionBatch read(OutputHandle output, List<String> expectedIds) throws IOException {
                throw new IOException("disk went away");
            }
        };

        assertThatThrownBy(() -> scorer(failingReader).score(table))
                .isInstanceOfSatisfying(ExecutionFailedException.class, ex -> {
                    assertThat(ex.getReason()).isEqualTo(FailureReason.MALFORMED_OUTPUT);
                    assertThat(ex.getMessage()).contains("disk went away");
                });
    }

    @Test
    void artifactIsReadBeforeAnotherRunIsAdmitted() throws Exception {
        useScript(ECHO_SCORER);
        CountDownLatch reading = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        PredictionOutputReader pausingReader = new PredictionOutputReader(codec, properties, clock) {
            @Override
            public PredictionBatch read(OutputHandle output, List<String> expectedIds) throws IOException {
                reading.countDown();
                awaitQuietly(release);
                return super.read(output, expectedIds);
            }
        };
        AtomicReference<PredictionBatch> first = new AtomicReference<>();
        Thread runner = new Thread(() -> first.set(scorer(pausingReader).score(table)));
        runner.start();
        assertThat(reading.await(10, TimeUnit.SECONDS)).isTrue();

        ValidatedTable other = TestTables.table(List.of("customerID", "score"), List.of("X", "0.2"), List.of("Y", "0.4"));
        assertThatThrownBy(() -> orchestrator.run(other, Duration.ofSeconds(20)))
                .isInstanceOf(PipelineBusyException.class);
        assertThat(Files.readString(workDir.resolve("predictions.csv"))).contains("B,0.5").doesNotContain("X,");

        release.countDown();
        runner.join(20_000);

        assertThat(first.get()).isNotNull();
        assertThat(first.get().records()).extracting(PredictionRecord::churnProbability)
                .containsExactly(0.1, 0.5, 0.9);
        assertThat(bulkhead.getMetrics().getAvailableConcurrentCalls()).isEqualTo(1);
    }

    private ProcessScorer scorer(PredictionOutputReader reader) {
        return new ProcessScorer(orchestrator, reader, properties);
    }

    private void assertFailure(FailureReason reason) {
        assertThatThrownBy(() -> scorer(new PredictionOutputReader(codec, properties, clock)).score(table))
                .isInstanceOfSatisfying(ExecutionFailedException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(reason));
    }

    private void useScript(String script) {
        properties.getScorer().setCommand(List.of("sh", "-c", script));
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(20, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
