package br.com.analytics.pipeline.device_lifecycle_batch.model;

public record InstalledDevice(
        DeviceRecord device,
        SerialCode serialCode
) {
}
