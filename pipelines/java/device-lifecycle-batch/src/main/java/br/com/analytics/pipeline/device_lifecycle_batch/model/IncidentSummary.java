package br.com.analytics.pipeline.device_lifecycle_batch.model;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;

public record IncidentSummary(
        int incidentCount,
        @Nullable LocalDate firstIncidentDate,
        @Nullable LocalDate lastIncidentDate,
        @Nullable String lastIncidentDescription
) {

    public static final IncidentSummary NONE = new IncidentSummary(0, null, null, null);
}
