package io.github.yok.flexbackup.core;

import java.nio.charset.StandardCharsets;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Date;

/**
 * Converts driver-level column values into JSON-friendly scalars.
 *
 * <p>
 * <strong>Conversions:</strong>
 * </p>
 * <ul>
 * <li>{@code byte[]} → UTF-8 text.</li>
 * <li>Date-time values → RFC 3339 text with offset (e.g. {@code 2024-05-01T10:15:30Z});
 * fractional seconds are kept only when non-zero. Zero/unset values (at or before
 * {@code 0001-01-01T00:00:00Z}) → {@code null}.</li>
 * <li>{@link Time} / {@link LocalTime} → {@code HH:mm:ss} text.</li>
 * <li>{@code null} → {@code null}.</li>
 * <li>Anything else is returned unchanged.</li>
 * </ul>
 *
 * <p>
 * Values without an offset ({@link LocalDateTime}, {@link LocalDate}, {@link java.sql.Date}) are
 * interpreted in the zone given at construction time. Instant-based values ({@link Timestamp},
 * {@link Instant}, {@link Date}) keep their instant and are rendered with that zone's offset.
 * The class never throws and is thread-safe.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class RowNormalizer {

    // Go-style zero time; drivers map MySQL zero dates onto it
    static final Instant ZERO_INSTANT = Instant.parse("0001-01-01T00:00:00Z");

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final ZoneId zone;

    /**
     * Creates a normalizer that reads zone-less values as UTC.
     */
    public RowNormalizer() {
        this(ZoneOffset.UTC);
    }

    /**
     * Creates a normalizer that reads zone-less values in the given zone.
     *
     * @param zone zone for values without offset
     */
    public RowNormalizer(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * Normalizes one column value.
     *
     * @param value raw value from the store
     * @return normalized value
     */
    public Object normalize(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof byte[]) {
            return new String((byte[]) value, StandardCharsets.UTF_8);
        }
        if (value instanceof Time) {
            return TIME_FORMAT.format(((Time) value).toLocalTime());
        }
        if (value instanceof LocalTime) {
            return TIME_FORMAT.format((LocalTime) value);
        }
        OffsetDateTime dateTime = toOffsetDateTime(value);
        if (dateTime == null) {
            return value;
        }
        if (!dateTime.toInstant().isAfter(ZERO_INSTANT)) {
            return null;
        }
        return FORMAT.format(dateTime);
    }

    private OffsetDateTime toOffsetDateTime(Object value) {
        if (value instanceof Timestamp) {
            // TIMESTAMP columns arrive as an instant already converted by the driver
            return ((Timestamp) value).toInstant().atZone(zone).toOffsetDateTime();
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().atStartOfDay(zone).toOffsetDateTime();
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant().atZone(zone).toOffsetDateTime();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).atZone(zone).toOffsetDateTime();
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay(zone).toOffsetDateTime();
        }
        if (value instanceof OffsetDateTime) {
            return (OffsetDateTime) value;
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toOffsetDateTime();
        }
        if (value instanceof Instant) {
            return ((Instant) value).atZone(zone).toOffsetDateTime();
        }
        return null;
    }
}
