package br.com.analytics.pipeline.device_lifecycle_batch.model;

import java.util.List;

public record MergeResult(
        List<MergedRecord> records,
        MergeReport report
) {

    public MergeResult {
        records = List.copyOf(records);
    }
}
