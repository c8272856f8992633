package br.com.analytics.pipeline.device_lifecycle_batch.processor;

import br.com.analytics.pipeline.device_lifecycle_batch.model.DeduplicationResult;
import br.com.analytics.pipeline.device_lifecycle_batch.model.MergedRecord;
import br.com.analytics.pipeline.device_lifecycle_batch.model.RecordDimension;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Drops repeated device entries. Records are stably sorted by normalized serial (ascending, missing
 * serials last) and the first record of each key survives, so the survivor does not depend on how
 * the input happened to be ordered beyond ties on the serial.
 */
public class Deduplicator {

    private static final Comparator<MergedRecord> BY_SERIAL =
            Comparator.comparing((MergedRecord record) -> RecordDimension.SERIAL.valueOf(record),
                    Comparator.nullsLast(Comparator.naturalOrder()));

    public DeduplicationResult dedupe(List<MergedRecord> records, List<RecordDimension> key) {
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Deduplication key must name at least one field");
        }
        List<MergedRecord> sorted = new ArrayList<>(records);
        sorted.sort(BY_SERIAL);

        Map<List<String>, Integer> occurrences = new HashMap<>();
        for (MergedRecord record : sorted) {
            occurrences.merge(keyOf(record, key), 1, Integer::sum);
        }

        Set<List<String>> seen = new HashSet<>();
        List<MergedRecord> kept = new ArrayList<>(sorted.size());
        for (MergedRecord record : sorted) {
            if (seen.add(keyOf(record, key))) {
                kept.add(record);
            }
        }

        int duplicatedRows = occurrences.values().stream().filter(n -> n > 1).mapToInt(Integer::intValue).sum();
        return new DeduplicationResult(kept, records.size() - kept.size(), duplicatedRows);
    }

    private static List<String> keyOf(MergedRecord record, List<RecordDimension> key) {
        String[] values = new String[key.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = key.get(i).valueOf(record);
        }
        return Arrays.asList(values);
    }
}
