package br.com.analytics.pipeline.device_lifecycle_batch.config;

import br.com.analytics.pipeline.device_lifecycle_batch.model.RecordDimension;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LifecyclePropertiesBindingTest {

    private static LifecycleProperties bind(Map<String, String> values) {
        Binder binder = new Binder(new MapConfigurationPropertySource(values));
        return binder.bindOrCreate("app.lifecycle", LifecycleProperties.class);
    }

    @Test
    void shouldApplyDefaults() {
        LifecycleProperties properties = bind(Map.of());

        assertThat(properties.getDedupKey()).containsExactly(RecordDimension.MODEL, RecordDimension.SERIAL);
        assertThat(properties.isFabricationFromSerial()).isTrue();
        assertThat(properties.getTtfIncidentBasis()).isEqualTo(LifecycleProperties.IncidentBasis.LAST);
        assertThat(properties.getSerial().getLength()).isEqualTo(7);
        assertThat(properties.getDates().getPatterns()).startsWith("yyyy-MM-dd", "dd/MM/yyyy");
        assertThat(properties.getOutput().getRecordsTable()).isEqualTo("device_lifecycle");
        assertThat(properties.getReferenceDate()).isNull();
        assertThat(properties.getOutput().getRecordsCsv()).isNull();
    }

    @Test
    void shouldBindRecordsCsvPath() {
        LifecycleProperties properties = bind(Map.of(
                "app.lifecycle.output.records-csv", "/var/export/device_lifecycle.csv"));

        assertThat(properties.getOutput().getRecordsCsv()).isEqualTo(Path.of("/var/export/device_lifecycle.csv"));
    }

    @Test
    void shouldBindRelaxedNamesAndViews() {
        LifecycleProperties properties = bind(Map.of(
                "app.lifecycle.installations.columns.serial", "no de série",
                "app.lifecycle.dedup-key", "serial",
                "app.lifecycle.ttf-incident-basis", "first",
                "app.lifecycle.reference-date", "2020-02-01",
                "app.lifecycle.serial.max-year-code", "30",
                "app.lifecycle.aggregations[0].name", "model-year",
                "app.lifecycle.aggregations[0].dimensions", "model,installation-year",
                "app.lifecycle.aggregations[0].collapse-long-tail", "true",
                "app.lifecycle.aggregations[0].other-threshold", "0.05"));

        assertThat(properties.getInstallations().getColumns().getSerial()).isEqualTo("no de série");
        assertThat(properties.getDedupKey()).containsExactly(RecordDimension.SERIAL);
        assertThat(properties.getTtfIncidentBasis()).isEqualTo(LifecycleProperties.IncidentBasis.FIRST);
        assertThat(properties.getReferenceDate()).isEqualTo(LocalDate.of(2020, 2, 1));
        assertThat(properties.getSerial().getMaxYearCode()).isEqualTo(30);
        assertThat(properties.getAggregations()).singleElement().satisfies(view -> {
            assertThat(view.getName()).isEqualTo("model-year");
            assertThat(view.getDimensions()).containsExactly(RecordDimension.MODEL, RecordDimension.INSTALLATION_YEAR);
            assertThat(view.isCollapseLongTail()).isTrue();
            assertThat(view.getOtherThreshold()).isEqualTo(0.05);
        });
    }
}
