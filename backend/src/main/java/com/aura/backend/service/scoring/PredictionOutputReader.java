package com.aura.backend.service.scoring;

import com.aura.backend.config.PipelineProperties;
import com.aura.backend.dto.ApiErrorDetail;
import com.aura.backend.exception.ValidationException;
import com.aura.backend.model.PredictionBatch;
import com.aura.backend.model.PredictionRecord;
import com.aura.backend.model.PredictionSource;
import com.aura.backend.model.RawTable;
import com.aura.backend.model.RiskLevel;
import com.aura.backend.service.CsvTableCodec;
import com.aura.backend.service.IdColumns;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses the scoring process artifact and checks it against the ids that were sent. Missing, extra or
 * repeated ids fail the whole artifact. Risk levels are always recomputed from the probability.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PredictionOutputReader {

    private static final List<String> PROBABILITY_COLUMNS = List.of(CsvTableCodec.PROBABILITY_COLUMN, "probability");

    private final CsvTableCodec codec;
    private final PipelineProperties properties;
    private final Clock clock;

    public PredictionBatch read(OutputHandle output, List<String> expectedIds) throws IOException {
        RawTable table;
        try (Reader reader = output.openReader()) {
            table = codec.read(reader);
        }
        PipelineProperties.Ingestion ingestion = properties.getIngestion();
        List<String> header = table.header();
        int idIndex = IdColumns.indexOf(header, ingestion.getIdColumn(), ingestion.getIdAliases());
        int probabilityIndex = IdColumns.indexOf(header, PROBABILITY_COLUMNS.get(0), PROBABILITY_COLUMNS.subList(1, 2));
        int riskIndex = IdColumns.indexOf(header, CsvTableCodec.RISK_LEVEL_COLUMN, List.of());

        List<ApiErrorDetail> details = new ArrayList<>();
        if (idIndex < 0) {
            details.add(detail(ingestion.getIdColumn(), "identifier column missing from scoring output"));
        }
        if (probabilityIndex < 0) {
            details.add(detail(CsvTableCodec.PROBABILITY_COLUMN, "probability column missing from scoring output"));
        }
        if (!details.isEmpty()) {
            throw new ValidationException("Malformed scoring output at " + output.location(), details);
        }

        Map<String, PredictionRecord> byId = new HashMap<>();
        Set<String> duplicates = new LinkedHashSet<>();
        int overridden = 0;
        for (int i = 0; i < table.rows().size(); i++) {
            List<String> row = table.rows().get(i);
            String id = cell(row, idIndex).trim();
            if (id.isEmpty()) {
                details.add(detail("row " + (i + 1), "identifier is blank"));
                continue;
            }
            Double probability = parseProbability(cell(row, probabilityIndex));
            if (probability == null) {
                details.add(detail(id, "probability '" + cell(row, probabilityIndex) + "' is not a number in [0,1]"));
                continue;
            }
            PredictionRecord record = PredictionRecord.of(id, probability);
            if (riskIndex >= 0 && disagrees(cell(row, riskIndex), record.riskLevel())) {
                overridden++;
            }
            if (byId.putIfAbsent(id, record) != null) {
                duplicates.add(id);
            }
        }
        duplicates.forEach(id -> details.add(detail(id, "identifier appears more than once")));

        Set<String> expected = new HashSet<>(expectedIds);
        List<String> missing = expectedIds.stream().filter(id -> !byId.containsKey(id)).toList();
        List<String> extra = byId.keySet().stream().filter(id -> !expected.contains(id)).sorted().toList();
        missing.forEach(id -> details.add(detail(id, "identifier missing from scoring output")));
        extra.forEach(id -> details.add(detail(id, "identifier was not in the input")));
        if (!details.isEmpty()) {
            throw new ValidationException("Malformed scoring output at " + output.location(), details);
        }
        if (overridden > 0) {
            log.warn("Scoring output risk_level disagreed with probability thresholds for {} rows; recomputed", overridden);
        }

        List<PredictionRecord> records = expectedIds.stream().map(byId::get).toList();
        return PredictionBatch.of(records, PredictionSource.MODEL, Instant.now(clock));
    }

    private static Double parseProbability(String value) {
        try {
            double parsed = Double.parseDouble(value.trim());
            if (Double.isNaN(parsed) || parsed < 0.0 || parsed > 1.0) {
                return null;
            }
            return parsed;
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static boolean disagrees(String label, RiskLevel derived) {
        return !label.isBlank() && !label.trim().equalsIgnoreCase(derived.getLabel());
    }

    private static String cell(List<String> row, int index) {
        if (index < 0 || index >= row.size() || row.get(index) == null) {
            return "";
        }
        return row.get(index);
    }

    private static ApiErrorDetail detail(String field, String issue) {
        return ApiErrorDetail.builder().field(field).issue(issue).build();
    }
}
