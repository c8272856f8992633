package br.com.analytics.pipeline.device_lifecycle_batch.model;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;

public record SerialCode(
        @Nullable String raw,
        @Nullable String normalizedDigits,
        @Nullable Integer monthCode,
        @Nullable Integer yearCode,
        @Nullable SerialRejection rejection,
        @Nullable LocalDate derivedFabricationDate
) {

    public static SerialCode valid(String raw, String digits, int month, int year, LocalDate fabricationDate) {
        return new SerialCode(raw, digits, month, year, null, fabricationDate);
    }

    public static SerialCode invalid(@Nullable String raw, @Nullable String digits,
                                     @Nullable Integer month, @Nullable Integer year,
                                     SerialRejection rejection) {
        return new SerialCode(raw, digits, month, year, rejection, null);
    }

    public boolean isValid() {
        return rejection == null;
    }

    public String status() {
        return rejection == null ? "valid" : "invalid:" + rejection.code();
    }
}
