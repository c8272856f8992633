package br.com.analytics.pipeline.device_lifecycle_batch.writer;

import org.springframework.batch.infrastructure.item.database.JdbcBatchItemWriter;

import java.util.List;
import java.util.stream.Collectors;

final class UpsertStatements {

    private UpsertStatements() {
    }

    static <T> JdbcBatchItemWriter<T> initialized(JdbcBatchItemWriter<T> writer) {
        try {
            writer.afterPropertiesSet();
        } catch (Exception e) {
            throw new IllegalStateException("Invalid upsert writer configuration", e);
        }
        return writer;
    }

    /**
     * PostgreSQL upsert with one named parameter per column; rows matching {@code conflictColumns}
     * are overwritten with the new values.
     */
    static String upsert(String table, List<String> columns, List<String> conflictColumns) {
        String names = String.join(", ", columns);
        String parameters = columns.stream().map(c -> ":" + c).collect(Collectors.joining(", "));
        String updates = columns.stream()
                .filter(c -> !conflictColumns.contains(c))
                .map(c -> c + " = EXCLUDED." + c)
                .collect(Collectors.joining(", "));
        return "INSERT INTO " + table + " (" + names + ") " +
                "VALUES (" + parameters + ") " +
                "ON CONFLICT (" + String.join(", ", conflictColumns) + ") DO UPDATE SET " + updates;
    }

    static String deleteAll(String table) {
        return "DELETE FROM " + table;
    }
}
