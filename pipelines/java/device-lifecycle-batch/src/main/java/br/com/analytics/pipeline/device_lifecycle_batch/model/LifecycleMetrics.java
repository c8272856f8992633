package br.com.analytics.pipeline.device_lifecycle_batch.model;

import org.jspecify.annotations.Nullable;

public record LifecycleMetrics(
        @Nullable Long timeToFailureDays,
        @Nullable TtfReference ttfReference,
        boolean ttfAnomalous,
        @Nullable Long ageSinceInstallationDays,
        @Nullable Long ageSinceFabricationDays,
        @Nullable Long stockDurationDays,
        @Nullable Long daysSinceLastConnection,
        boolean incidentWithoutReturn
) {

    public static final double DAYS_PER_MONTH = 30.44;

    public static @Nullable Double toMonths(@Nullable Long days) {
        return days == null ? null : days / DAYS_PER_MONTH;
    }

    public @Nullable Double timeToFailureMonths() {
        return toMonths(timeToFailureDays);
    }

    public @Nullable Double ageSinceInstallationMonths() {
        return toMonths(ageSinceInstallationDays);
    }

    public @Nullable Double ageSinceFabricationMonths() {
        return toMonths(ageSinceFabricationDays);
    }

    public @Nullable Double stockDurationMonths() {
        return toMonths(stockDurationDays);
    }
}
