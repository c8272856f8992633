package br.com.analytics.pipeline.device_lifecycle_batch.model;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public record MergedRecord(
        DeviceRecord device,
        SerialCode serialCode,
        IncidentSummary incidents,
        ReturnSummary returns,
        @Nullable LifecycleMetrics metrics
) {

    public static final List<String> DEVICE_COLUMNS = List.of(
            "serial", "model", "subsidiary", "fabrication_date", "installation_date", "last_connection_date");

    public static final Map<String, String> DERIVED_COLUMNS = derivedColumns();

    public static final List<String> COLUMNS = exportColumns();

    public MergedRecord withMetrics(LifecycleMetrics computed) {
        return new MergedRecord(device, serialCode, incidents, returns, computed);
    }

    public MergedRecord withDevice(DeviceRecord updated) {
        return new MergedRecord(updated, serialCode, incidents, returns, metrics);
    }

    public @Nullable String serial() {
        return device.serial();
    }

    public @Nullable String model() {
        return device.model();
    }

    public @Nullable String subsidiary() {
        return device.subsidiary();
    }

    public Map<String, Object> canonicalRow() {
        Map<String, Object> row = deviceValues();
        row.putAll(derivedValues());
        return Collections.unmodifiableMap(row);
    }

    /**
     * Row in export order: installation columns, installation passthrough columns, then derived
     * columns. A derived column whose name is taken gets its source suffix; if the suffixed name is
     * taken as well the derived value is dropped.
     */
    public Map<String, Object> toRow() {
        Map<String, Object> row = deviceValues();
        device.attributes().forEach((name, value) -> {
            if (!row.containsKey(name)) {
                row.put(name, value);
            }
        });
        derivedValues().forEach((name, value) -> {
            if (!row.containsKey(name)) {
                row.put(name, value);
                return;
            }
            String suffixed = name + DERIVED_COLUMNS.get(name);
            if (!row.containsKey(suffixed)) {
                row.put(suffixed, value);
            }
        });
        return Collections.unmodifiableMap(row);
    }

    private Map<String, Object> deviceValues() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("serial", device.serial());
        row.put("model", device.model());
        row.put("subsidiary", device.subsidiary());
        row.put("fabrication_date", device.fabricationDate());
        row.put("installation_date", device.installationDate());
        row.put("last_connection_date", device.lastConnectionDate());
        return row;
    }

    private Map<String, Object> derivedValues() {
        LifecycleMetrics m = metrics;
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("serial_status", serialCode.status());
        values.put("serial_month_code", serialCode.monthCode());
        values.put("serial_year_code", serialCode.yearCode());
        values.put("serial_fabrication_date", serialCode.derivedFabricationDate());
        values.put("incident_count", incidents.incidentCount());
        values.put("first_incident_date", incidents.firstIncidentDate());
        values.put("last_incident_date", incidents.lastIncidentDate());
        values.put("last_incident_description", incidents.lastIncidentDescription());
        values.put("return_count", returns.returnCount());
        values.put("last_return_date", returns.lastReturnDate());
        values.put("last_return_id", returns.lastReturnId());
        values.put("ttf_days", m == null ? null : m.timeToFailureDays());
        values.put("ttf_months", m == null ? null : m.timeToFailureMonths());
        values.put("ttf_reference", m == null || m.ttfReference() == null ? null : m.ttfReference().name().toLowerCase(Locale.ROOT));
        values.put("ttf_anomalous", m != null && m.ttfAnomalous());
        values.put("age_since_installation_days", m == null ? null : m.ageSinceInstallationDays());
        values.put("age_since_installation_months", m == null ? null : m.ageSinceInstallationMonths());
        values.put("age_since_fabrication_days", m == null ? null : m.ageSinceFabricationDays());
        values.put("age_since_fabrication_months", m == null ? null : m.ageSinceFabricationMonths());
        values.put("stock_duration_days", m == null ? null : m.stockDurationDays());
        values.put("stock_duration_months", m == null ? null : m.stockDurationMonths());
        values.put("days_since_last_connection", m == null ? null : m.daysSinceLastConnection());
        values.put("incident_without_return", m != null && m.incidentWithoutReturn());
        return values;
    }

    private static Map<String, String> derivedColumns() {
        Map<String, String> columns = new LinkedHashMap<>();
        for (String name : List.of("serial_status", "serial_month_code", "serial_year_code", "serial_fabrication_date")) {
            columns.put(name, "_serial");
        }
        for (String name : List.of("incident_count", "first_incident_date", "last_incident_date", "last_incident_description")) {
            columns.put(name, "_incident");
        }
        for (String name : List.of("return_count", "last_return_date", "last_return_id")) {
            columns.put(name, "_return");
        }
        for (String name : List.of("ttf_days", "ttf_months", "ttf_reference", "ttf_anomalous",
                "age_since_installation_days", "age_since_installation_months",
                "age_since_fabrication_days", "age_since_fabrication_months",
                "stock_duration_days", "stock_duration_months",
                "days_since_last_connection", "incident_without_return")) {
            columns.put(name, "_metric");
        }
        return Collections.unmodifiableMap(columns);
    }

    private static List<String> exportColumns() {
        List<String> columns = new ArrayList<>(DEVICE_COLUMNS);
        columns.addAll(DERIVED_COLUMNS.keySet());
        return List.copyOf(columns);
    }
}
