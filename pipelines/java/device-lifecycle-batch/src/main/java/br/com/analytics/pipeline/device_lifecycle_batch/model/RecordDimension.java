package br.com.analytics.pipeline.device_lifecycle_batch.model;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.util.function.Function;

public enum RecordDimension {

    MODEL(MergedRecord::model),
    SUBSIDIARY(MergedRecord::subsidiary),
    SERIAL(record -> record.serialCode().normalizedDigits()),
    SERIAL_STATUS(record -> record.serialCode().status()),
    INSTALLATION_YEAR(record -> year(record.device().installationDate())),
    FABRICATION_YEAR(record -> year(record.device().fabricationDate()));

    private final Function<MergedRecord, @Nullable String> extractor;

    RecordDimension(Function<MergedRecord, @Nullable String> extractor) {
        this.extractor = extractor;
    }

    public @Nullable String valueOf(MergedRecord record) {
        return extractor.apply(record);
    }

    private static @Nullable String year(@Nullable LocalDate date) {
        return date == null ? null : Integer.toString(date.getYear());
    }
}
