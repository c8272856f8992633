package br.com.analytics.pipeline.device_lifecycle_batch.processor;

import br.com.analytics.pipeline.device_lifecycle_batch.config.ColumnResolver;
import br.com.analytics.pipeline.device_lifecycle_batch.config.LifecycleConfigurationException;
import br.com.analytics.pipeline.device_lifecycle_batch.config.LifecycleProperties;
import br.com.analytics.pipeline.device_lifecycle_batch.config.LifecycleProperties.AggregationView;
import br.com.analytics.pipeline.device_lifecycle_batch.model.MergedRecord;
import br.com.analytics.pipeline.device_lifecycle_batch.model.ReconciliationResult;
import br.com.analytics.pipeline.device_lifecycle_batch.model.RecordDimension;
import br.com.analytics.pipeline.device_lifecycle_batch.model.SourceTable;
import br.com.analytics.pipeline.device_lifecycle_batch.model.SourceTables;
import br.com.analytics.pipeline.device_lifecycle_batch.model.TtfReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static br.com.analytics.pipeline.device_lifecycle_batch.LifecycleFixtures.DESCRIPTION;
import static br.com.analytics.pipeline.device_lifecycle_batch.LifecycleFixtures.FABRICATION;
import static br.com.analytics.pipeline.device_lifecycle_batch.LifecycleFixtures.INCIDENT_DATE;
import static br.com.analytics.pipeline.device_lifecycle_batch.LifecycleFixtures.INSTALLATION;
import static br.com.analytics.pipeline.device_lifecycle_batch.LifecycleFixtures.LAST_CONNECTION;
import static br.com.analytics.pipeline.device_lifecycle_batch.LifecycleFixtures.MODEL;
import static br.com.analytics.pipeline.device_lifecycle_batch.LifecycleFixtures.RETURN_DATE;
import static br.com.analytics.pipeline.device_lifecycle_batch.LifecycleFixtures.RMA;
import static br.com.analytics.pipeline.device_lifecycle_batch.LifecycleFixtures.SERIAL;
import static br.com.analytics.pipeline.device_lifecycle_batch.LifecycleFixtures.SUBSIDIARY;
import static br.com.analytics.pipeline.device_lifecycle_batch.LifecycleFixtures.properties;
import static br.com.analytics.pipeline.device_lifecycle_batch.LifecycleFixtures.row;
import static br.com.analytics.pipeline.device_lifecycle_batch.LifecycleFixtures.table;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeviceLifecyclePipelineTest {

    private static final Clock CLOCK = Clock.fixed(
            LocalDate.of(2020, 2, 1).atStartOfDay(ZoneOffset.UTC).toInstant(), ZoneOffset.UTC);

    private static final List<String> INSTALLATION_COLUMNS =
            List.of(SERIAL, MODEL, SUBSIDIARY, FABRICATION, INSTALLATION, LAST_CONNECTION, "technicien");
    private static final List<String> INCIDENT_COLUMNS = List.of(SERIAL, INCIDENT_DATE, DESCRIPTION);
    private static final List<String> RETURN_COLUMNS = List.of(SERIAL, RETURN_DATE, RMA);

    private LifecycleProperties properties;

    @BeforeEach
    void setUp() {
        properties = properties();
    }

    private DeviceLifecyclePipeline pipeline() {
        return new DeviceLifecyclePipeline(
                new ColumnResolver(properties),
                new DateNormalizer(properties.getDates()),
                new SerialCodeParser(properties.getSerial()),
                new RecordMerger(),
                new Deduplicator(),
                new MetricsCalculator(CLOCK, properties.isFabricationFromSerial(), properties.getTtfIncidentBasis()),
                new Aggregator(),
                properties.getDedupKey(),
                List.of(new AggregationView("by-model", List.of(RecordDimension.MODEL)),
                        new AggregationView("by-subsidiary", List.of(RecordDimension.SUBSIDIARY))));
    }

    private SourceTables sources() {
        SourceTable installations = table("installations", INSTALLATION_COLUMNS,
                row("0118001", "T-100", "FR", null, "01/02/2018", "2020-01-22", "Dupont"),
                row("0118001", "T-100", "FR", null, "01/02/2018", "2020-01-22", "Dupont"),
                row(118002.0, "T-100", "BE", null, "2018-03-05", null, "Martin"),
                row("1318003", "T-200", "FR", "2018-01-10", "not a date", null, null));
        SourceTable incidents = table("incidents", INCIDENT_COLUMNS,
                row("0118001", "2019-06-01", "screen"),
                row("0118001", "2018-12-01", "power"),
                row("0118001", "2019-01-15 08:30", "modem"),
                row("7777777", "2019-01-15", "orphan"));
        SourceTable returns = table("returns", RETURN_COLUMNS,
                row("1318003", "2019-09-09", "RMA-42"));
        return new SourceTables(installations, incidents, returns);
    }

    @Test
    void shouldReconcileSourcesIntoOneRowPerDevice() {
        ReconciliationResult result = pipeline().run(sources());

        assertThat(result.records()).extracting(MergedRecord::serial)
                .containsExactly("0118001", "118002", "1318003");

        MergedRecord failing = result.records().get(0);
        assertThat(failing.serialCode().isValid()).isTrue();
        assertThat(failing.device().fabricationDate()).isEqualTo(LocalDate.of(2018, 1, 1));
        assertThat(failing.incidents().incidentCount()).isEqualTo(3);
        assertThat(failing.returns().returnCount()).isZero();
        assertThat(failing.metrics().timeToFailureDays()).isEqualTo(485L);
        assertThat(failing.metrics().ttfReference()).isEqualTo(TtfReference.INSTALLATION);
        assertThat(failing.metrics().incidentWithoutReturn()).isTrue();
        assertThat(failing.toRow()).containsEntry("technicien", "Dupont");

        MergedRecord shortSerial = result.records().get(1);
        assertThat(shortSerial.serialCode().status()).isEqualTo("invalid:length");
        assertThat(shortSerial.metrics().timeToFailureDays()).isNull();

        MergedRecord returned = result.records().get(2);
        assertThat(returned.serialCode().status()).isEqualTo("invalid:month");
        assertThat(returned.device().installationDate()).isNull();
        assertThat(returned.returns().lastReturnId()).isEqualTo("RMA-42");
    }

    @Test
    void shouldProduceViewsFleetAndReport() {
        ReconciliationResult result = pipeline().run(sources());

        assertThat(result.views()).containsOnlyKeys("by-model", "by-subsidiary");
        assertThat(result.views().get("by-model")).extracting(b -> b.key().label()).containsExactly("T-100", "T-200");
        assertThat(result.fleet().count()).isEqualTo(3);
        assertThat(result.fleet().ttfCount()).isEqualTo(1);
        assertThat(result.allBuckets()).hasSize(4);

        assertThat(result.report().installationRows()).isEqualTo(4);
        assertThat(result.report().removedDuplicates()).isEqualTo(1);
        assertThat(result.report().duplicatedRows()).isEqualTo(2);
        assertThat(result.report().invalidSerials()).isEqualTo(2);
        assertThat(result.report().invalidDateCounts()).containsEntry("installations.date d'installation", 1);
        assertThat(result.report().totalInvalidDates()).isEqualTo(1);
        assertThat(result.report().merge().orphanIncidentSerials()).isEqualTo(1);
    }

    @Test
    void shouldCountDeviceOnceWhenSerialIsWrittenWithDigitGlyphs() {
        SourceTable installations = table("installations", INSTALLATION_COLUMNS,
                row("0118001", "T-100", "FR", null, "2018-02-01", null, null),
                row("⁰118001", "T-100", "FR", null, "2018-02-01", null, null));
        SourceTable incidents = table("incidents", INCIDENT_COLUMNS,
                row("0118001", "2019-06-01", "screen"),
                row("⁰118001", "2019-01-15", "power"));
        SourceTable returns = table("returns", RETURN_COLUMNS);

        ReconciliationResult result = pipeline().run(new SourceTables(installations, incidents, returns));

        assertThat(result.records()).hasSize(1);
        assertThat(result.report().removedDuplicates()).isEqualTo(1);
        assertThat(result.fleet().count()).isEqualTo(1);
        assertThat(result.fleet().incidentTotal()).isEqualTo(2);
    }

    @Test
    void shouldBeRepeatableForSameInputsAndClock() {
        assertThat(pipeline().run(sources())).isEqualTo(pipeline().run(sources()));
    }

    @Test
    void shouldFailBeforeAnyStageWhenColumnsAreMissing() {
        properties.getInstallations().getColumns().setModel("model");
        properties.getReturns().getColumns().setReturnDate("returned_on");

        assertThatThrownBy(() -> pipeline().run(sources()))
                .isInstanceOfSatisfying(LifecycleConfigurationException.class, e -> assertThat(e.getMissingFields())
                        .containsExactly("installations.model -> 'model'", "returns.return-date -> 'returned_on'"));
    }
}
