package io.github.yok.hirelink.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;
import lombok.Generated;
import org.apache.commons.lang3.StringUtils;

/**
 * ISO-8601 timestamp helpers shared by the validator and the codecs.
 *
 * <p>
 * All structured values are UTC {@link LocalDateTime}s at second precision. Two parsers are
 * provided:
 * </p>
 * <ul>
 * <li>{@link #parseStrict(String)}: exactly {@code yyyy-MM-dd'T'HH:mm:ss'Z'}, used for historical
 * CSV files.</li>
 * <li>{@link #parseLenient(String)}: any ISO-8601 date-time with or without an offset, or a bare
 * date, used for batch requests and backup artifacts.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public final class IsoTimestamps {

    /**
     * Canonical text format: {@code yyyy-MM-dd'T'HH:mm:ss'Z'}.
     */
    public static final DateTimeFormatter CANONICAL =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss'Z'")
                    .withResolverStyle(ResolverStyle.STRICT);

    // Date-time with optional offset ("Z", "+02:00") and optional fraction. STRICT rejects
    // 2021-02-30 and 24:00:00 instead of adjusting them.
    private static final DateTimeFormatter ISO_WITH_OPTIONAL_OFFSET =
            new DateTimeFormatterBuilder().append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
                    .optionalStart().appendOffsetId().optionalEnd().toFormatter()
                    .withResolverStyle(ResolverStyle.STRICT);

    @Generated
    private IsoTimestamps() {}

    /**
     * Formats a UTC date-time in the canonical format.
     *
     * @param utc UTC date-time
     * @return canonical text, or {@code null} if {@code utc} is {@code null}
     */
    public static String format(LocalDateTime utc) {
        return (utc == null) ? null : truncate(utc).format(CANONICAL);
    }

    /**
     * Drops sub-second precision.
     *
     * @param value date-time
     * @return value truncated to seconds
     */
    public static LocalDateTime truncate(LocalDateTime value) {
        return value.truncatedTo(ChronoUnit.SECONDS);
    }

    /**
     * Parses the canonical {@code yyyy-MM-dd'T'HH:mm:ss'Z'} format only.
     *
     * @param text input text
     * @return parsed value, or empty if blank or not in the canonical format
     */
    public static Optional<LocalDateTime> parseStrict(String text) {
        if (StringUtils.isBlank(text)) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDateTime.parse(text.trim(), CANONICAL));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Parses ISO-8601 text and normalizes it to UTC.
     *
     * <p>
     * Accepted shapes: {@code 2021-02-10T08:15:00Z}, {@code 2021-02-10T10:15:00+02:00},
     * {@code 2021-02-10T08:15:00} (taken as UTC), {@code 2021-02-10T08:15:00.250Z} and
     * {@code 2021-02-10} (midnight UTC). A space may be used instead of {@code T}.
     * </p>
     *
     * @param text input text
     * @return UTC value truncated to seconds, or empty if the text is blank or unparseable
     */
    public static Optional<LocalDateTime> parseLenient(String text) {
        if (StringUtils.isBlank(text)) {
            return Optional.empty();
        }
        String normalized = text.trim();
        if (normalized.length() > 10 && normalized.charAt(10) == ' ') {
            normalized = normalized.substring(0, 10) + 'T' + normalized.substring(11);
        }
        try {
            if (normalized.length() == 10) {
                return Optional.of(LocalDate.parse(normalized).atStartOfDay());
            }
            TemporalAccessor parsed = ISO_WITH_OPTIONAL_OFFSET.parseBest(normalized,
                    OffsetDateTime::from, LocalDateTime::from);
            LocalDateTime utc;
            if (parsed instanceof OffsetDateTime) {
                utc = ((OffsetDateTime) parsed).withOffsetSameInstant(ZoneOffset.UTC)
                        .toLocalDateTime();
            } else {
                utc = (LocalDateTime) parsed;
            }
            return Optional.of(truncate(utc));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
