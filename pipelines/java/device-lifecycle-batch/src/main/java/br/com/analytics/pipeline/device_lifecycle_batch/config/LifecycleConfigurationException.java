package br.com.analytics.pipeline.device_lifecycle_batch.config;

import java.util.List;

public class LifecycleConfigurationException extends RuntimeException {

    private final List<String> missingFields;

    public LifecycleConfigurationException(List<String> missingFields) {
        super("Column mapping does not match the source tables, missing: " + String.join(", ", missingFields));
        this.missingFields = List.copyOf(missingFields);
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
