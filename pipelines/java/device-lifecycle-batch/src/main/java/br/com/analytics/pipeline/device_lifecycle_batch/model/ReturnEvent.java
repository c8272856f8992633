package br.com.analytics.pipeline.device_lifecycle_batch.model;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;

public record ReturnEvent(
        @Nullable String serial,
        @Nullable LocalDate returnDate,
        @Nullable String rmaId
) {
}
