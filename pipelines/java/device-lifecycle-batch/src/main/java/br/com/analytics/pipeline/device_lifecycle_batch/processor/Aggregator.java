package br.com.analytics.pipeline.device_lifecycle_batch.processor;

import br.com.analytics.pipeline.device_lifecycle_batch.model.AggregateBucket;
import br.com.analytics.pipeline.device_lifecycle_batch.model.AggregationKey;
import br.com.analytics.pipeline.device_lifecycle_batch.model.LifecycleMetrics;
import br.com.analytics.pipeline.device_lifecycle_batch.model.MergedRecord;
import br.com.analytics.pipeline.device_lifecycle_batch.model.RecordDimension;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.function.Function;
import java.util.stream.LongStream;

public class Aggregator {

    public static final String FLEET_VIEW = "fleet";

    private static final Comparator<AggregateBucket> BUCKET_ORDER = Comparator
            .comparing((AggregateBucket b) -> isOther(b.key()))
            .thenComparing(AggregateBucket::count, Comparator.reverseOrder())
            .thenComparing(AggregateBucket::key);

    public List<AggregateBucket> aggregate(String view, List<MergedRecord> records, List<RecordDimension> dimensions) {
        return aggregate(view, records, dimensions, null);
    }

    /**
     * Groups records by the combined values of {@code dimensions}. With a non-null
     * {@code otherThreshold}, every combination holding a smaller share of the records is folded into
     * a single "Other" bucket; the records themselves are left untouched.
     */
    public List<AggregateBucket> aggregate(String view, List<MergedRecord> records, List<RecordDimension> dimensions,
                                           @Nullable Double otherThreshold) {
        if (dimensions.isEmpty()) {
            throw new IllegalArgumentException("View '" + view + "' needs at least one dimension");
        }
        Map<AggregationKey, List<MergedRecord>> groups = new LinkedHashMap<>();
        for (MergedRecord record : records) {
            groups.computeIfAbsent(keyOf(record, dimensions), k -> new ArrayList<>()).add(record);
        }
        if (otherThreshold != null && !records.isEmpty()) {
            groups = collapseLongTail(groups, records.size(), otherThreshold, dimensions.size());
        }

        List<AggregateBucket> buckets = new ArrayList<>(groups.size());
        groups.forEach((key, members) -> buckets.add(bucketOf(view, dimensions, key, members)));
        buckets.sort(BUCKET_ORDER);
        return buckets;
    }

    public AggregateBucket summarize(List<MergedRecord> records) {
        return bucketOf(FLEET_VIEW, List.of(), new AggregationKey(List.of()), records);
    }

    private static Map<AggregationKey, List<MergedRecord>> collapseLongTail(
            Map<AggregationKey, List<MergedRecord>> groups, int total, double threshold, int width) {
        Map<AggregationKey, List<MergedRecord>> collapsed = new LinkedHashMap<>();
        List<MergedRecord> other = new ArrayList<>();
        groups.forEach((key, members) -> {
            if ((double) members.size() / total < threshold) {
                other.addAll(members);
            } else {
                collapsed.put(key, members);
            }
        });
        if (!other.isEmpty()) {
            collapsed.merge(AggregationKey.other(width), other, (existing, extra) -> {
                List<MergedRecord> all = new ArrayList<>(existing);
                all.addAll(extra);
                return all;
            });
        }
        return collapsed;
    }

    private static AggregateBucket bucketOf(String view, List<RecordDimension> dimensions,
                                            AggregationKey key, List<MergedRecord> members) {
        List<LifecycleMetrics> metrics = members.stream()
                .map(MergedRecord::metrics)
                .filter(m -> m != null)
                .toList();
        long[] ttf = metrics.stream()
                .map(LifecycleMetrics::timeToFailureDays)
                .filter(d -> d != null)
                .mapToLong(Long::longValue)
                .toArray();

        return new AggregateBucket(
                view,
                List.copyOf(dimensions),
                key,
                members.size(),
                ttf.length,
                ttf.length == 0 ? null : LongStream.of(ttf).average().getAsDouble(),
                ttf.length == 0 ? null : LongStream.of(ttf).min().getAsLong(),
                ttf.length == 0 ? null : LongStream.of(ttf).max().getAsLong(),
                mean(metrics, LifecycleMetrics::ageSinceFabricationDays),
                mean(metrics, LifecycleMetrics::ageSinceInstallationDays),
                mean(metrics, LifecycleMetrics::daysSinceLastConnection),
                members.stream().filter(r -> r.incidents().incidentCount() > 0).count(),
                members.stream().filter(r -> r.returns().returnCount() > 0).count(),
                members.stream().mapToLong(r -> r.incidents().incidentCount()).sum(),
                members.stream().mapToLong(r -> r.returns().returnCount()).sum(),
                metrics.stream().filter(LifecycleMetrics::incidentWithoutReturn).count(),
                members.stream().filter(r -> !r.serialCode().isValid()).count(),
                metrics.stream().filter(LifecycleMetrics::ttfAnomalous).count());
    }

    private static @Nullable Double mean(List<LifecycleMetrics> metrics, Function<LifecycleMetrics, @Nullable Long> field) {
        OptionalDouble average = metrics.stream()
                .map(field)
                .filter(v -> v != null)
                .mapToLong(Long::longValue)
                .average();
        return average.isPresent() ? average.getAsDouble() : null;
    }

    private static AggregationKey keyOf(MergedRecord record, List<RecordDimension> dimensions) {
        List<String> values = new ArrayList<>(dimensions.size());
        for (RecordDimension dimension : dimensions) {
            String value = dimension.valueOf(record);
            values.add(value == null ? AggregationKey.NONE : value);
        }
        return new AggregationKey(values);
    }

    private static boolean isOther(AggregationKey key) {
        return !key.values().isEmpty() && key.values().stream().allMatch(AggregationKey.OTHER::equals);
    }
}
