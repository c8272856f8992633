package br.com.analytics.pipeline.device_lifecycle_batch.model;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record DeviceRecord(
        @Nullable String serial,
        @Nullable String model,
        @Nullable String subsidiary,
        @Nullable LocalDate fabricationDate,
        @Nullable LocalDate installationDate,
        @Nullable LocalDate lastConnectionDate,
        Map<String, Object> attributes
) {

    public DeviceRecord {
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public DeviceRecord withFabricationDate(@Nullable LocalDate date) {
        return new DeviceRecord(serial, model, subsidiary, date, installationDate, lastConnectionDate, attributes);
    }
}
