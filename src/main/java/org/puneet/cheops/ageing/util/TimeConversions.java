package org.puneet.cheops.ageing.util;

import org.puneet.cheops.ageing.config.AnalysisConfig;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversions between UTC timestamps and modified Julian dates.
 *
 * <p>All series times inside the engine are MJD days. Timestamps without a zone are taken as
 * UTC.</p>
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class TimeConversions {

    private static final double SECONDS_PER_DAY = 86_400.0;
    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private static final Pattern FILE_DATE = Pattern.compile("TU(\\d{4}-\\d{2}-\\d{2})");
    private static final Pattern FILE_TARGET = Pattern.compile("TG(\\d+)");

    private TimeConversions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Parses an ISO-8601 UTC timestamp such as {@code 2024-01-15T12:00:00.250},
     * {@code 2024-01-15T12:00:00Z} or {@code 2024-01-15}.
     *
     * @param text the timestamp
     * @return the MJD
     * @throws DateTimeParseException if the text is not a supported timestamp
     */
    public static double isoToMjd(String text) {
        if (text == null) {
            throw new DateTimeParseException("Timestamp is null", "", 0);
        }
        String trimmed = text.trim().replace(' ', 'T');
        Instant instant;
        if (trimmed.length() == 10) {
            instant = LocalDate.parse(trimmed).atStartOfDay(ZoneOffset.UTC).toInstant();
        } else if (trimmed.endsWith("Z") || hasOffset(trimmed)) {
            instant = OffsetDateTime.parse(trimmed).toInstant();
        } else {
            instant = LocalDateTime.parse(trimmed).toInstant(ZoneOffset.UTC);
        }
        return instantToMjd(instant);
    }

    public static double instantToMjd(Instant instant) {
        return instant.getEpochSecond() / SECONDS_PER_DAY
                + instant.getNano() / (SECONDS_PER_DAY * 1e9)
                + AnalysisConfig.MJD_UNIX_EPOCH;
    }

    /**
     * @return the instant of an MJD, rounded to the millisecond
     */
    public static Instant mjdToInstant(double mjd) {
        return Instant.ofEpochMilli(Math.round((mjd - AnalysisConfig.MJD_UNIX_EPOCH) * MILLIS_PER_DAY));
    }

    /**
     * @return the UTC calendar date of an MJD as {@code yyyy-MM-dd}
     */
    public static String mjdToIsoDate(double mjd) {
        return DateTimeFormatter.ISO_LOCAL_DATE.format(mjdToInstant(mjd).atZone(ZoneOffset.UTC));
    }

    /**
     * Visit date encoded in a product file name as {@code TU<yyyy-MM-dd>}.
     *
     * @return the MJD of that date at 00:00 UTC, empty if the name carries no valid date
     */
    public static OptionalDouble visitDateFromFileName(String fileName) {
        if (fileName == null) {
            return OptionalDouble.empty();
        }
        Matcher matcher = FILE_DATE.matcher(fileName);
        if (!matcher.find()) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(isoToMjd(matcher.group(1)));
        } catch (DateTimeParseException e) {
            return OptionalDouble.empty();
        }
    }

    /**
     * Target encoded in a product file name as {@code TG<number>}.
     *
     * @return e.g. {@code TG001234}, empty if absent
     */
    public static Optional<String> targetFromFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        Matcher matcher = FILE_TARGET.matcher(fileName);
        return matcher.find() ? Optional.of("TG" + matcher.group(1)) : Optional.empty();
    }

    private static boolean hasOffset(String text) {
        int timeStart = text.indexOf('T');
        if (timeStart < 0) {
            return false;
        }
        String time = text.substring(timeStart);
        return time.indexOf('+') >= 0 || time.indexOf('-') >= 0;
    }
}
