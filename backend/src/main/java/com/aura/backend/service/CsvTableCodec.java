package com.aura.backend.service;

import com.aura.backend.exception.ValidationException;
import com.aura.backend.model.CustomerRecord;
import com.aura.backend.model.PredictionBatch;
import com.aura.backend.model.PredictionRecord;
import com.aura.backend.model.RawTable;
import com.aura.backend.model.ValidatedTable;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the tables exchanged with clients and with the scoring process.
 */
@Component
@RequiredArgsConstructor
public class CsvTableCodec {

    public static final String PROBABILITY_COLUMN = "churn_probability";
    public static final String RISK_LEVEL_COLUMN = "risk_level";

    private static final char BOM = '\uFEFF';

    private final CsvMapper csvMapper;

    public RawTable read(InputStream input) throws IOException {
        return read(new InputStreamReader(input, StandardCharsets.UTF_8));
    }

    public RawTable read(Reader input) throws IOException {
        ObjectReader reader = csvMapper.readerForListOf(String.class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .with(CsvParser.Feature.TRIM_SPACES);
        List<List<String>> lines = new ArrayList<>();
        try (MappingIterator<List<String>> iterator = reader.readValues(input)) {
            while (iterator.hasNextValue()) {
                lines.add(iterator.nextValue());
            }
        } catch (JsonProcessingException ex) {
            throw new ValidationException("Unreadable CSV: " + ex.getOriginalMessage());
        }
        if (lines.isEmpty()) {
            return new RawTable(List.of(), List.of());
        }
        List<String> header = new ArrayList<>(lines.get(0));
        if (!header.isEmpty() && !header.get(0).isEmpty() && header.get(0).charAt(0) == BOM) {
            header.set(0, header.get(0).substring(1));
        }
        return new RawTable(header, lines.subList(1, lines.size()));
    }

    public void writeTable(ValidatedTable table, Writer output) throws IOException {
        CsvSchema.Builder schema = CsvSchema.builder();
        table.columns().forEach(schema::addColumn);
        try (SequenceWriter writer = csvMapper.writer(schema.build().withHeader()).writeValues(output)) {
            for (CustomerRecord record : table.records()) {
                Map<String, String> row = new LinkedHashMap<>();
                for (String column : table.columns()) {
                    row.put(column, column.equals(table.idColumn())
                            ? record.customerId()
                            : record.features().getOrDefault(column, ""));
                }
                writer.write(row);
            }
        }
    }

    /**
     * Exports a batch with exactly the identifier, probability and risk level columns.
     */
    public String writePredictions(PredictionBatch batch, String idColumn) throws IOException {
        CsvSchema schema = CsvSchema.builder()
                .addColumn(idColumn)
                .addColumn(PROBABILITY_COLUMN)
                .addColumn(RISK_LEVEL_COLUMN)
                .build()
                .withHeader();
        StringWriter output = new StringWriter();
        try (SequenceWriter writer = csvMapper.writer(schema).writeValues(output)) {
            for (PredictionRecord record : batch.records()) {
                Map<String, String> row = new LinkedHashMap<>();
                row.put(idColumn, record.customerId());
                row.put(PROBABILITY_COLUMN, Double.toString(record.churnProbability()));
                row.put(RISK_LEVEL_COLUMN, record.riskLevel().getLabel());
                writer.write(row);
            }
        }
        return output.toString();
    }
}
