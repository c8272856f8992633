package br.com.analytics.pipeline.device_lifecycle_batch.model;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public record AggregateBucket(
        String view,
        List<RecordDimension> dimensions,
        AggregationKey key,
        long count,
        long ttfCount,
        @Nullable Double meanTtfDays,
        @Nullable Long minTtfDays,
        @Nullable Long maxTtfDays,
        @Nullable Double meanAgeDays,
        @Nullable Double meanAgeSinceInstallationDays,
        @Nullable Double meanDaysSinceLastConnection,
        long devicesWithIncident,
        long devicesReturned,
        long incidentTotal,
        long returnTotal,
        long incidentWithoutReturnCount,
        long invalidSerialCount,
        long anomalousTtfCount
) {

    public static final List<String> COLUMNS = List.of(
            "view_name", "dimensions", "group_key", "group_label", "device_count", "ttf_count",
            "mean_ttf_days", "min_ttf_days", "max_ttf_days", "mean_ttf_months",
            "mean_age_days", "mean_age_months", "mean_age_since_installation_days",
            "mean_days_since_last_connection",
            "devices_with_incident", "devices_returned", "incident_total", "return_total",
            "incident_without_return_count", "invalid_serial_count", "anomalous_ttf_count",
            "incident_rate", "return_rate");

    public boolean isTtfDefined() {
        return ttfCount > 0;
    }

    public @Nullable Double meanTtfMonths() {
        return meanTtfDays == null ? null : meanTtfDays / LifecycleMetrics.DAYS_PER_MONTH;
    }

    public @Nullable Double meanAgeMonths() {
        return meanAgeDays == null ? null : meanAgeDays / LifecycleMetrics.DAYS_PER_MONTH;
    }

    public double incidentRate() {
        return count == 0 ? 0.0 : (double) devicesWithIncident / count;
    }

    public double returnRate() {
        return count == 0 ? 0.0 : (double) devicesReturned / count;
    }

    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("view_name", view);
        row.put("dimensions", dimensions.stream().map(d -> d.name().toLowerCase(Locale.ROOT)).reduce((a, b) -> a + "," + b).orElse(""));
        row.put("group_key", key.storageKey());
        row.put("group_label", key.label());
        row.put("device_count", count);
        row.put("ttf_count", ttfCount);
        row.put("mean_ttf_days", meanTtfDays);
        row.put("min_ttf_days", minTtfDays);
        row.put("max_ttf_days", maxTtfDays);
        row.put("mean_ttf_months", meanTtfMonths());
        row.put("mean_age_days", meanAgeDays);
        row.put("mean_age_months", meanAgeMonths());
        row.put("mean_age_since_installation_days", meanAgeSinceInstallationDays);
        row.put("mean_days_since_last_connection", meanDaysSinceLastConnection);
        row.put("devices_with_incident", devicesWithIncident);
        row.put("devices_returned", devicesReturned);
        row.put("incident_total", incidentTotal);
        row.put("return_total", returnTotal);
        row.put("incident_without_return_count", incidentWithoutReturnCount);
        row.put("invalid_serial_count", invalidSerialCount);
        row.put("anomalous_ttf_count", anomalousTtfCount);
        row.put("incident_rate", incidentRate());
        row.put("return_rate", returnRate());
        return Collections.unmodifiableMap(row);
    }
}
