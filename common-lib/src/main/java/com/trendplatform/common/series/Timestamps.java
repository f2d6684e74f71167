package com.trendplatform.common.series;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/**
 * ISO-8601 parsing and rendering shared by the window filter and the predictor.
 *
 * <p>Accepted inputs, most specific first:
 * <ul>
 *   <li>{@code 2024-03-01T12:00:00Z}, {@code 2024-03-01T12:00:00.250+02:00} — offset date-time</li>
 *   <li>{@code 2024-03-01T12:00:00} — local date-time, read as UTC</li>
 *   <li>{@code 2024-03-01} — date, read as UTC midnight</li>
 * </ul>
 */
public final class Timestamps {

    private static final Logger log = LoggerFactory.getLogger(Timestamps.class);

    private static final DateTimeFormatter FLEXIBLE_ISO = new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
                .appendOffsetId()
            .optionalEnd()
        .optionalEnd()
        .toFormatter();

    private static final DateTimeFormatter MILLIS_UTC =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private Timestamps() {}

    /**
     * @return the parsed instant, or empty when {@code raw} is null, blank or not ISO-8601
     */
    public static Optional<Instant> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            TemporalAccessor parsed = FLEXIBLE_ISO.parseBest(raw.trim(),
                OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime odt) return Optional.of(odt.toInstant());
            if (parsed instanceof LocalDateTime ldt) return Optional.of(ldt.toInstant(ZoneOffset.UTC));
            return Optional.of(((LocalDate) parsed).atStartOfDay().toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            log.debug("Unparseable timestamp excluded. raw={} reason={}", raw, e.getMessage());
            return Optional.empty();
        }
    }

    /** Renders {@code epochMillis} as {@code yyyy-MM-dd'T'HH:mm:ss.SSS'Z'}. */
    public static String format(long epochMillis) {
        return MILLIS_UTC.format(Instant.ofEpochMilli(epochMillis));
    }
}
