package com.sentiment_retraining.dto.data;

import java.util.List;
import java.util.Map;

/**
 * Raw tabular view of a CSV file: the header in file order and one map per row.
 * Blank cells are stored as {@code null}.
 */
public record CsvTable(List<String> header, List<Map<String, String>> rows) {

    public boolean hasColumn(String column) {
        return header.contains(column);
    }

    public List<String> column(String column) {
        return rows.stream().map(row -> row.get(column)).toList();
    }

    public int rowCount() {
        return rows.size();
    }
}
