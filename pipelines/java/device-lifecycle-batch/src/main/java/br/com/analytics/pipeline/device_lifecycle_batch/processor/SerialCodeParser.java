package br.com.analytics.pipeline.device_lifecycle_batch.processor;

import br.com.analytics.pipeline.device_lifecycle_batch.config.LifecycleProperties;
import br.com.analytics.pipeline.device_lifecycle_batch.model.SerialCode;
import br.com.analytics.pipeline.device_lifecycle_batch.model.SerialRejection;
import org.jspecify.annotations.Nullable;

import java.time.LocalDate;

public class SerialCodeParser {

    private static final String SUPERSCRIPT_DIGITS = "⁰¹²³⁴⁵⁶⁷⁸⁹";
    private static final String SUBSCRIPT_DIGITS = "₀₁₂₃₄₅₆₇₈₉";

    private final int length;
    private final int monthOffset;
    private final int yearOffset;
    private final int minYearCode;
    private final int maxYearCode;
    private final int centuryBase;

    public SerialCodeParser(LifecycleProperties.Serial rules) {
        if (Math.max(rules.getMonthOffset(), rules.getYearOffset()) + 2 > rules.getLength()) {
            throw new IllegalArgumentException("Month and year codes must fit inside a serial of length " + rules.getLength());
        }
        if (rules.getMinYearCode() > rules.getMaxYearCode()) {
            throw new IllegalArgumentException("Serial year window is empty: "
                    + rules.getMinYearCode() + ".." + rules.getMaxYearCode());
        }
        this.length = rules.getLength();
        this.monthOffset = rules.getMonthOffset();
        this.yearOffset = rules.getYearOffset();
        this.minYearCode = rules.getMinYearCode();
        this.maxYearCode = rules.getMaxYearCode();
        this.centuryBase = rules.getCenturyBase();
    }

    public SerialCode parse(@Nullable String serial) {
        String digits = normalize(serial);
        if (digits == null || digits.length() != length || !isAsciiDigits(digits)) {
            return SerialCode.invalid(serial, digits, null, null, SerialRejection.LENGTH);
        }
        int month = Integer.parseInt(digits.substring(monthOffset, monthOffset + 2));
        int year = Integer.parseInt(digits.substring(yearOffset, yearOffset + 2));
        if (month < 1 || month > 12) {
            return SerialCode.invalid(serial, digits, month, year, SerialRejection.MONTH);
        }
        if (year < minYearCode || year > maxYearCode) {
            return SerialCode.invalid(serial, digits, month, year, SerialRejection.YEAR_WINDOW);
        }
        return SerialCode.valid(serial, digits, month, year, LocalDate.of(centuryBase + year, month, 1));
    }

    /**
     * Trims the serial and maps superscript and subscript digit glyphs to ASCII digits. Also used as
     * the join key across sources, so "⁰118001" and "0118001" denote the same device.
     */
    public static @Nullable String normalize(@Nullable String serial) {
        if (serial == null) {
            return null;
        }
        String trimmed = serial.strip();
        if (trimmed.isEmpty()) {
            return null;
        }
        StringBuilder normalized = new StringBuilder(trimmed.length());
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            int digit = SUPERSCRIPT_DIGITS.indexOf(c);
            if (digit < 0) {
                digit = SUBSCRIPT_DIGITS.indexOf(c);
            }
            normalized.append(digit >= 0 ? (char) ('0' + digit) : c);
        }
        return normalized.toString();
    }

    private static boolean isAsciiDigits(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
