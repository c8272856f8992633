package br.com.analytics.pipeline.device_lifecycle_batch.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ReconciliationResult(
        List<MergedRecord> records,
        Map<String, List<AggregateBucket>> views,
        AggregateBucket fleet,
        RunReport report
) {

    public ReconciliationResult {
        records = List.copyOf(records);
        views = Collections.unmodifiableMap(new LinkedHashMap<>(views));
    }

    public List<AggregateBucket> allBuckets() {
        return views.values().stream().flatMap(List::stream).toList();
    }
}
