package com.aura.backend.model;

import java.util.List;

public record ValidatedTable(
        String idColumn,
        List<String> columns,
        List<CustomerRecord> records,
        List<String> warnings,
        double qualityScore
) {

    public ValidatedTable {
        columns = List.copyOf(columns);
        records = List.copyOf(records);
        warnings = List.copyOf(warnings);
    }

    public List<String> customerIds() {
        return records.stream().map(CustomerRecord::customerId).toList();
    }

    public int size() {
        return records.size();
    }
}
