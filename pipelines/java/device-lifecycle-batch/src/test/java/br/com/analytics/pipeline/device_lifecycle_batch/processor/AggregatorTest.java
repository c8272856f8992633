package br.com.analytics.pipeline.device_lifecycle_batch.processor;

import br.com.analytics.pipeline.device_lifecycle_batch.config.LifecycleProperties.IncidentBasis;
import br.com.analytics.pipeline.device_lifecycle_batch.model.AggregateBucket;
import br.com.analytics.pipeline.device_lifecycle_batch.model.AggregationKey;
import br.com.analytics.pipeline.device_lifecycle_batch.model.IncidentSummary;
import br.com.analytics.pipeline.device_lifecycle_batch.model.MergedRecord;
import br.com.analytics.pipeline.device_lifecycle_batch.model.RecordDimension;
import br.com.analytics.pipeline.device_lifecycle_batch.model.ReturnSummary;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static br.com.analytics.pipeline.device_lifecycle_batch.LifecycleFixtures.device;
import static br.com.analytics.pipeline.device_lifecycle_batch.LifecycleFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AggregatorTest {

    private static final Clock CLOCK = Clock.fixed(
            LocalDate.of(2020, 2, 1).atStartOfDay(ZoneOffset.UTC).toInstant(), ZoneOffset.UTC);

    private final MetricsCalculator calculator = new MetricsCalculator(CLOCK, true, IncidentBasis.LAST);
    private final Aggregator aggregator = new Aggregator();

    private MergedRecord failed(String serial, String model, LocalDate installed, LocalDate incident) {
        IncidentSummary incidents = new IncidentSummary(1, incident, incident, null);
        return calculator.computeMetrics(record(device(serial, model, "FR", installed), incidents, ReturnSummary.NONE));
    }

    private MergedRecord healthy(String serial, String model) {
        return calculator.computeMetrics(record(device(serial, model, "FR", LocalDate.of(2019, 2, 1))));
    }

    @Test
    void shouldComputeStatisticsPerModel() {
        List<MergedRecord> records = List.of(
                failed("0118001", "T-100", LocalDate.of(2018, 2, 1), LocalDate.of(2018, 3, 3)),
                failed("0118002", "T-100", LocalDate.of(2018, 2, 1), LocalDate.of(2018, 2, 11)),
                healthy("0118003", "T-100"),
                healthy("0118004", "T-200"));

        List<AggregateBucket> buckets = aggregator.aggregate("by-model", records, List.of(RecordDimension.MODEL));

        assertThat(buckets).extracting(b -> b.key().label()).containsExactly("T-100", "T-200");
        AggregateBucket t100 = buckets.get(0);
        assertThat(t100.count()).isEqualTo(3);
        assertThat(t100.ttfCount()).isEqualTo(2);
        assertThat(t100.meanTtfDays()).isCloseTo(20.0, within(1e-9));
        assertThat(t100.minTtfDays()).isEqualTo(10L);
        assertThat(t100.maxTtfDays()).isEqualTo(30L);
        assertThat(t100.devicesWithIncident()).isEqualTo(2);
        assertThat(t100.incidentWithoutReturnCount()).isEqualTo(2);
        assertThat(t100.incidentRate()).isCloseTo(2.0 / 3, within(1e-9));
    }

    @Test
    void shouldReportUndefinedTtfForBucketsWithoutFailures() {
        List<MergedRecord> records = List.of(healthy("0118003", "T-200"), healthy("0118004", "T-200"));

        AggregateBucket bucket = aggregator.aggregate("by-model", records, List.of(RecordDimension.MODEL)).get(0);

        assertThat(bucket.isTtfDefined()).isFalse();
        assertThat(bucket.meanTtfDays()).isNull();
        assertThat(bucket.minTtfDays()).isNull();
        assertThat(bucket.maxTtfDays()).isNull();
        assertThat(bucket.meanTtfMonths()).isNull();
        assertThat(bucket.toRow()).containsEntry("mean_ttf_days", null);
    }

    @Test
    void shouldGroupMissingValuesUnderNone() {
        List<MergedRecord> records = List.of(healthy("0118003", null), healthy("0118004", "T-200"));

        List<AggregateBucket> buckets = aggregator.aggregate("by-model", records, List.of(RecordDimension.MODEL));

        assertThat(buckets).extracting(b -> b.key().label()).containsExactly(AggregationKey.NONE, "T-200");
    }

    @Test
    void shouldCollapseLongTailWithoutTouchingRecords() {
        List<MergedRecord> records = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            records.add(healthy(String.format("0118%03d", i), "T-100"));
        }
        for (int i = 0; i < 38; i++) {
            records.add(healthy(String.format("0218%03d", i), "T-200"));
        }
        records.add(failed("0318001", "X-1", LocalDate.of(2018, 2, 1), LocalDate.of(2018, 3, 3)));
        records.add(healthy("0318002", "X-2"));
        List<MergedRecord> before = List.copyOf(records);

        List<AggregateBucket> buckets = aggregator.aggregate("by-model", records, List.of(RecordDimension.MODEL), 0.02);

        assertThat(buckets).extracting(b -> b.key().label()).containsExactly("T-100", "T-200", AggregationKey.OTHER);
        AggregateBucket other = buckets.get(2);
        assertThat(other.count()).isEqualTo(2);
        assertThat(other.ttfCount()).isEqualTo(1);
        assertThat(other.meanTtfDays()).isCloseTo(30.0, within(1e-9));
        assertThat(records).isEqualTo(before);
        assertThat(buckets.stream().mapToLong(AggregateBucket::count).sum()).isEqualTo(records.size());
    }

    @Test
    void shouldGroupOnSeveralDimensions() {
        List<MergedRecord> records = List.of(healthy("0118003", "T-100"), healthy("0118004", "T-100"));

        List<AggregateBucket> buckets = aggregator.aggregate("model-year", records,
                List.of(RecordDimension.MODEL, RecordDimension.INSTALLATION_YEAR));

        assertThat(buckets).singleElement()
                .satisfies(b -> assertThat(b.key().label()).isEqualTo("T-100 / 2019"));
    }

    @Test
    void shouldSummarizeWholeFleet() {
        List<MergedRecord> records = List.of(
                failed("0118001", "T-100", LocalDate.of(2018, 2, 1), LocalDate.of(2018, 3, 3)),
                healthy("1399999", "T-200"));

        AggregateBucket fleet = aggregator.summarize(records);

        assertThat(fleet.view()).isEqualTo(Aggregator.FLEET_VIEW);
        assertThat(fleet.count()).isEqualTo(2);
        assertThat(fleet.invalidSerialCount()).isEqualTo(1);
        assertThat(fleet.key().label()).isEmpty();
    }

    @Test
    void shouldRequireAtLeastOneDimension() {
        assertThatThrownBy(() -> aggregator.aggregate("empty", List.of(), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
