package com.id.chrono.modules.csv.util;

import com.id.chrono.modules.csv.model.enums.CsvDateFormat;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses the date column of quote files into epoch millis (UTC midnight for plain dates).
 */
public final class CsvDateParser {

    private static final DateTimeFormatter D_MMM_YY = DateTimeFormatter.ofPattern("d-MMM-yy", Locale.US);
    private static final List<CsvDateFormat> AUTO_ORDER = List.of(
            CsvDateFormat.ISO_DATE,
            CsvDateFormat.ISO_8601,
            CsvDateFormat.D_MMM_YY,
            CsvDateFormat.EPOCH_MILLIS
    );

    private CsvDateParser() {
    }

    public static CsvDateFormat resolveFormat(Object raw) {
        if (raw == null) {
            return CsvDateFormat.AUTO;
        }
        String normalized = raw.toString().trim().toUpperCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return CsvDateFormat.AUTO;
        }
        try {
            return CsvDateFormat.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            return CsvDateFormat.AUTO;
        }
    }

    /**
     * @return epoch millis, or empty when the value does not match the format
     */
    public static Optional<Long> parse(String value, CsvDateFormat format) {
        if (value == null || format == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        return switch (format) {
            case AUTO -> AUTO_ORDER.stream()
                    .map(candidate -> parse(trimmed, candidate))
                    .flatMap(Optional::stream)
                    .findFirst();
            case ISO_DATE -> parseDate(trimmed, DateTimeFormatter.ISO_LOCAL_DATE);
            case D_MMM_YY -> parseDate(trimmed, D_MMM_YY);
            case ISO_8601 -> parseIso(trimmed);
            case EPOCH_MILLIS -> parseEpochMillis(trimmed);
        };
    }

    private static Optional<Long> parseDate(String value, DateTimeFormatter formatter) {
        try {
            return Optional.of(LocalDate.parse(value, formatter).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli());
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    private static Optional<Long> parseIso(String value) {
        try {
            return Optional.of(Instant.parse(value).toEpochMilli());
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    private static Optional<Long> parseEpochMillis(String value) {
        try {
            return Optional.of(Long.parseLong(value));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
