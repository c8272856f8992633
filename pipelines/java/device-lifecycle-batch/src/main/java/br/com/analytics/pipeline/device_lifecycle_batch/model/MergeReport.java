package br.com.analytics.pipeline.device_lifecycle_batch.model;

public record MergeReport(
        int incidentRowsWithoutSerial,
        int returnRowsWithoutSerial,
        int orphanIncidentSerials,
        int orphanReturnSerials,
        int serialsWithSeveralIncidents,
        int serialsWithSeveralReturns
) {
}
