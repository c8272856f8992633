package br.com.analytics.pipeline.device_lifecycle_batch.model;

import java.util.Map;

public record RunReport(
        int installationRows,
        int incidentRows,
        int returnRows,
        Map<String, Integer> invalidDateCounts,
        long invalidSerials,
        MergeReport merge,
        int removedDuplicates,
        int duplicatedRows,
        long anomalousTtf
) {

    public RunReport {
        invalidDateCounts = Map.copyOf(invalidDateCounts);
    }

    public int totalInvalidDates() {
        return invalidDateCounts.values().stream().mapToInt(Integer::intValue).sum();
    }
}
