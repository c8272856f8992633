package br.com.analytics.pipeline.device_lifecycle_batch.config;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

public record ResolvedColumns(
        Installations installations,
        Incidents incidents,
        Returns returns
) {

    public record Installations(
            String serial,
            String model,
            String subsidiary,
            @Nullable String fabricationDate,
            String installationDate,
            @Nullable String lastConnectionDate
    ) {

        public List<String> mapped() {
            List<String> mapped = new ArrayList<>(List.of(serial, model, subsidiary, installationDate));
            Stream.of(fabricationDate, lastConnectionDate).filter(c -> c != null).forEach(mapped::add);
            return mapped;
        }
    }

    public record Incidents(
            String serial,
            String incidentDate,
            @Nullable String description
    ) {
    }

    public record Returns(
            String serial,
            String returnDate,
            @Nullable String rmaId
    ) {
    }
}
