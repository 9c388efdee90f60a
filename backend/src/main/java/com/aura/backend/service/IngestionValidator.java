package com.aura.backend.service;

import com.aura.backend.config.PipelineProperties;
import com.aura.backend.dto.ApiErrorDetail;
import com.aura.backend.exception.ValidationException;
import com.aura.backend.model.CustomerRecord;
import com.aura.backend.model.RawTable;
import com.aura.backend.model.ValidatedTable;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Checks an uploaded table for the identifier column, non-empty content and unique identifiers.
 * Duplicate identifiers are rejected, never deduplicated.
 */
@Component
@RequiredArgsConstructor
public class IngestionValidator {

    private final PipelineProperties properties;

    public ValidatedTable validate(RawTable table) {
        PipelineProperties.Ingestion rules = properties.getIngestion();
        if (table.header().isEmpty()) {
            throw new ValidationException("Uploaded table is empty");
        }

        int idIndex = IdColumns.indexOf(table.header(), rules.getIdColumn(), rules.getIdAliases());
        if (idIndex < 0) {
            throw new ValidationException("Missing required column: " + rules.getIdColumn(), List.of(
                    detail(rules.getIdColumn(), "required identifier column is missing")));
        }

        List<ApiErrorDetail> details = new ArrayList<>();
        checkHeader(table.header(), details);
        if (table.rows().isEmpty()) {
            throw new ValidationException("Uploaded table has no data rows");
        }

        List<String> columns = new ArrayList<>(table.header());
        columns.set(idIndex, rules.getIdColumn());

        List<CustomerRecord> records = new ArrayList<>(table.rows().size());
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        long filledCells = 0;
        for (int i = 0; i < table.rows().size(); i++) {
            List<String> row = table.rows().get(i);
            String rowLabel = "row " + (i + 1);
            if (row.size() > columns.size()) {
                details.add(detail(rowLabel, "has " + row.size() + " values but the header has " + columns.size()));
                continue;
            }
            String id = cell(row, idIndex).trim();
            if (id.isEmpty()) {
                details.add(detail(rowLabel, rules.getIdColumn() + " is blank"));
                continue;
            }
            if (!seen.add(id)) {
                duplicates.add(id);
                continue;
            }
            Map<String, String> features = new LinkedHashMap<>();
            for (int c = 0; c < columns.size(); c++) {
                String value = cell(row, c);
                if (!value.isBlank()) {
                    filledCells++;
                }
                if (c != idIndex) {
                    features.put(columns.get(c), value);
                }
            }
            records.add(new CustomerRecord(id, features));
        }
        duplicates.forEach(id -> details.add(detail(rules.getIdColumn(), "duplicate identifier " + id)));
        if (!details.isEmpty()) {
            throw new ValidationException("Invalid customer data", details);
        }

        double quality = (double) filledCells / ((long) records.size() * columns.size());
        return new ValidatedTable(rules.getIdColumn(), columns, records, warnings(records, quality, rules), quality);
    }

    private void checkHeader(List<String> header, List<ApiErrorDetail> details) {
        Set<String> names = new HashSet<>();
        for (int c = 0; c < header.size(); c++) {
            String name = header.get(c).trim();
            if (name.isEmpty()) {
                details.add(detail("column " + (c + 1), "header name is blank"));
            } else if (!names.add(name.toLowerCase(Locale.ROOT))) {
                details.add(detail(name, "column appears more than once"));
            }
        }
        if (!details.isEmpty()) {
            throw new ValidationException("Invalid header", details);
        }
    }

    private List<String> warnings(List<CustomerRecord> records, double quality, PipelineProperties.Ingestion rules) {
        List<String> warnings = new ArrayList<>();
        if (quality < rules.getMinQualityScore()) {
            warnings.add(String.format(Locale.ROOT, "Data quality score is low: %.2f", quality));
        }
        for (String column : rules.getNumericColumns()) {
            long invalid = records.stream()
                    .filter(record -> record.text(column).isPresent() && record.numeric(column).isEmpty())
                    .count();
            if (invalid > 0) {
                warnings.add("Column " + column + " has " + invalid + " non-numeric values");
            }
        }
        return warnings;
    }

    private static String cell(List<String> row, int index) {
        if (index >= row.size() || row.get(index) == null) {
            return "";
        }
        return row.get(index);
    }

    private static ApiErrorDetail detail(String field, String issue) {
        return ApiErrorDetail.builder().field(field).issue(issue).build();
    }
}
