package br.com.analytics.pipeline.device_lifecycle_batch.model;

public enum SerialRejection {

    LENGTH("length"),
    MONTH("month"),
    YEAR_WINDOW("year-window");

    private final String code;

    SerialRejection(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
