package br.com.analytics.pipeline.device_lifecycle_batch.model;

import java.util.List;

public record SourceTable(
        String name,
        List<String> columns,
        List<TableRow> rows
) {

    public SourceTable {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public int size() {
        return rows.size();
    }
}
