package br.com.analytics.pipeline.device_lifecycle_batch.model;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;

public record ReturnSummary(
        int returnCount,
        @Nullable LocalDate lastReturnDate,
        @Nullable String lastReturnId
) {

    public static final ReturnSummary NONE = new ReturnSummary(0, null, null);
}
