package br.com.analytics.pipeline.device_lifecycle_batch.model;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public record AggregationKey(
        List<String> values
) implements Comparable<AggregationKey> {

    public static final String NONE = "(none)";
    public static final String OTHER = "Other";

    private static final char SEPARATOR = '\u001F';

    public AggregationKey {
        values = List.copyOf(values);
    }

    public static AggregationKey other(int width) {
        return new AggregationKey(Collections.nCopies(width, OTHER));
    }

    public String label() {
        return String.join(" / ", values);
    }

    /**
     * Values joined by the ASCII unit separator, with backslashes and separators inside a value
     * escaped, so two different keys never share a stored form.
     */
    public String storageKey() {
        return values.stream()
                .map(value -> value.replace("\\", "\\\\").replace(String.valueOf(SEPARATOR), "\\" + SEPARATOR))
                .collect(Collectors.joining(String.valueOf(SEPARATOR)));
    }

    @Override
    public int compareTo(AggregationKey other) {
        for (int i = 0; i < Math.min(values.size(), other.values.size()); i++) {
            int cmp = values.get(i).compareTo(other.values.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(values.size(), other.values.size());
    }
}
