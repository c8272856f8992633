package br.com.analytics.pipeline.device_lifecycle_batch.model;

public record SourceTables(
        SourceTable installations,
        SourceTable incidents,
        SourceTable returns
) {
}
