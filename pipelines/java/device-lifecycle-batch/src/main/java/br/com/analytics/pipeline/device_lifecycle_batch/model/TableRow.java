package br.com.analytics.pipeline.device_lifecycle_batch.model;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record TableRow(
        Map<String, Object> cells
) {

    public TableRow {
        cells = Collections.unmodifiableMap(new LinkedHashMap<>(cells));
    }

    public static TableRow of(Map<String, ?> cells) {
        return new TableRow(new LinkedHashMap<>(cells));
    }

    public @Nullable Object get(String column) {
        return cells.get(column);
    }

    /**
     * Cell rendered as trimmed text, or null when absent or blank. Integral numbers lose their
     * fractional part so that a serial read as 118001.0 joins with "118001".
     */
    public @Nullable String text(String column) {
        Object value = cells.get(column);
        if (value == null) {
            return null;
        }
        String text;
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            text = number == Math.rint(number) && !Double.isInfinite(number)
                    ? Long.toString((long) number)
                    : value.toString();
        } else if (value instanceof BigDecimal decimal) {
            text = decimal.stripTrailingZeros().toPlainString();
        } else {
            text = value.toString();
        }
        text = text.strip();
        return text.isEmpty() ? null : text;
    }
}
