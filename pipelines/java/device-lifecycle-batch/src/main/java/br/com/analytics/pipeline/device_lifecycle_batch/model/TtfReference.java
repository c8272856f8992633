package br.com.analytics.pipeline.device_lifecycle_batch.model;

public enum TtfReference {
    INSTALLATION,
    FABRICATION
}
