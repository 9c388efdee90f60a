package com.aura.backend.model;

import java.util.List;

/**
 * Parsed CSV before validation. Rows are positional and may be shorter or longer than the header.
 */
public record RawTable(List<String> header, List<List<String>> rows) {

    public RawTable {
        header = List.copyOf(header);
        rows = rows.stream().map(List::copyOf).toList();
    }

    public boolean isEmpty() {
        return header.isEmpty() || rows.isEmpty();
    }
}
