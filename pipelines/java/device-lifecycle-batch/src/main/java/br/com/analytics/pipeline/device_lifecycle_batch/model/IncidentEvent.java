package br.com.analytics.pipeline.device_lifecycle_batch.model;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;

public record IncidentEvent(
        @Nullable String serial,
        @Nullable LocalDate incidentDate,
        @Nullable String description
) {
}
