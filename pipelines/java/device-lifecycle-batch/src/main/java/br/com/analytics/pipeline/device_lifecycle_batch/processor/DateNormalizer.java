package br.com.analytics.pipeline.device_lifecycle_batch.processor;

import br.com.analytics.pipeline.device_lifecycle_batch.config.LifecycleProperties;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw cells into calendar dates using an explicit, ordered list of patterns.
 * <p>
 * Order of attempts:
 * <ol>
 *   <li>typed date/time values are accepted as they are;</li>
 *   <li>text is tried against each configured pattern, strictly, so "31/02/2020" never matches;</li>
 *   <li>ISO date-time forms and the date part in front of a time component are tried last;</li>
 *   <li>numbers (or numeric text) are spreadsheet serial dates when enabled.</li>
 * </ol>
 * A value that fails every attempt becomes null and is counted; blank cells are missing values,
 * not failures.
 */
public class DateNormalizer {

    static final LocalDate SPREADSHEET_EPOCH = LocalDate.of(1899, 12, 30);

    private static final Pattern LEADING_DATE = Pattern.compile("^(\\S+?)[ T]\\d{1,2}:\\d{2}.*$");
    private static final Pattern NUMERIC = Pattern.compile("^\\d+(\\.\\d+)?$");

    private final List<DateTimeFormatter> formatters;
    private final boolean spreadsheetSerialDates;
    private final int minYear;
    private final int maxYear;
    private final long maxSerial;

    public DateNormalizer(LifecycleProperties.Dates dates) {
        List<DateTimeFormatter> compiled = new ArrayList<>();
        for (String pattern : dates.getPatterns()) {
            compiled.add(compile(pattern));
        }
        this.formatters = List.copyOf(compiled);
        this.spreadsheetSerialDates = dates.isSpreadsheetSerialDates();
        this.minYear = dates.getMinYear();
        this.maxYear = dates.getMaxYear();
        this.maxSerial = ChronoUnit.DAYS.between(SPREADSHEET_EPOCH, LocalDate.of(maxYear, 12, 31));
    }

    public record NormalizedColumn(
            String column,
            List<@Nullable LocalDate> dates,
            int invalidCount
    ) {
    }

    public NormalizedColumn normalizeColumn(String column, List<?> cells) {
        List<@Nullable LocalDate> dates = new ArrayList<>(cells.size());
        int invalid = 0;
        for (Object cell : cells) {
            LocalDate date = normalize(cell);
            if (date == null && !isBlank(cell)) {
                invalid++;
            }
            dates.add(date);
        }
        return new NormalizedColumn(column, Collections.unmodifiableList(dates), invalid);
    }

    public @Nullable LocalDate normalize(@Nullable Object value) {
        if (isBlank(value)) {
            return null;
        }
        LocalDate typed = fromTemporal(value);
        if (typed != null) {
            return plausible(typed);
        }
        if (value instanceof Number number) {
            return spreadsheetSerialDates ? fromSerial(number.doubleValue()) : null;
        }
        return parseText(value.toString().strip());
    }

    private @Nullable LocalDate parseText(String text) {
        LocalDate date = tryPatterns(text);
        if (date != null) {
            return date;
        }
        date = tryGeneric(text);
        if (date != null) {
            return date;
        }
        if (spreadsheetSerialDates && NUMERIC.matcher(text).matches()) {
            return fromSerial(Double.parseDouble(text));
        }
        return null;
    }

    private @Nullable LocalDate tryPatterns(String text) {
        for (DateTimeFormatter formatter : formatters) {
            LocalDate date = plausible(parseWith(formatter, text));
            if (date != null) {
                return date;
            }
        }
        return null;
    }

    private @Nullable LocalDate tryGeneric(String text) {
        LocalDate date = plausible(parseWith(DateTimeFormatter.ISO_DATE_TIME, text));
        if (date != null) {
            return date;
        }
        Matcher matcher = LEADING_DATE.matcher(text);
        if (matcher.matches()) {
            return tryPatterns(matcher.group(1));
        }
        return null;
    }

    private static @Nullable LocalDate parseWith(DateTimeFormatter formatter, String text) {
        try {
            return formatter.parse(text, LocalDate::from);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private @Nullable LocalDate fromSerial(double serial) {
        if (Double.isNaN(serial) || serial < 1 || serial >= maxSerial + 1) {
            return null;
        }
        return plausible(SPREADSHEET_EPOCH.plusDays((long) Math.floor(serial)));
    }

    private @Nullable LocalDate plausible(@Nullable LocalDate date) {
        if (date == null || date.getYear() < minYear || date.getYear() > maxYear) {
            return null;
        }
        return date;
    }

    private static @Nullable LocalDate fromTemporal(Object value) {
        if (value instanceof LocalDate date) {
            return date;
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (value instanceof OffsetDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (value instanceof ZonedDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (value instanceof Instant instant) {
            return instant.atOffset(ZoneOffset.UTC).toLocalDate();
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate();
        }
        if (value instanceof java.sql.Timestamp timestamp) {
            return timestamp.toLocalDateTime().toLocalDate();
        }
        if (value instanceof java.util.Date date) {
            return date.toInstant().atOffset(ZoneOffset.UTC).toLocalDate();
        }
        return null;
    }

    private static boolean isBlank(@Nullable Object value) {
        return value == null || (value instanceof CharSequence text && text.toString().isBlank());
    }

    /**
     * Compiles a pattern written with the usual {@code yyyy} notation. Strict resolution needs the
     * proleptic year ({@code u}) since year-of-era without an era never resolves.
     */
    static DateTimeFormatter compile(String pattern) {
        StringBuilder converted = new StringBuilder(pattern.length());
        boolean quoted = false;
        for (char c : pattern.toCharArray()) {
            if (c == '\'') {
                quoted = !quoted;
            }
            converted.append(!quoted && c == 'y' ? 'u' : c);
        }
        return DateTimeFormatter.ofPattern(converted.toString(), Locale.ROOT)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
