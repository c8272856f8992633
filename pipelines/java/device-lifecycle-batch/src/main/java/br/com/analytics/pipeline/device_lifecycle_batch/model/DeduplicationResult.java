package br.com.analytics.pipeline.device_lifecycle_batch.model;

import java.util.List;

/**
 * @param removedCount       rows dropped, i.e. occurrences of a key beyond its first
 * @param duplicatedRowCount rows whose key occurs more than once, survivors included
 */
public record DeduplicationResult(
        List<MergedRecord> records,
        int removedCount,
        int duplicatedRowCount
) {

    public DeduplicationResult {
        records = List.copyOf(records);
    }
}
