package io.github.yok.hirelink.model;

import io.github.yok.hirelink.util.IsoTimestamps;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.Objects;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;

/**
 * Hire timestamp of an employee.
 *
 * <p>
 * Normally holds a UTC {@link LocalDateTime} truncated to seconds. Values decoded from legacy
 * backups that cannot be parsed are kept as their raw text so that a restore never loses them.
 * </p>
 */
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class HireTimestamp {

    private final LocalDateTime value;
    private final String raw;

    /**
     * Creates a parsed timestamp.
     *
     * @param utc UTC date-time; sub-second precision is dropped
     * @return timestamp holding a structured value
     */
    public static HireTimestamp of(LocalDateTime utc) {
        Objects.requireNonNull(utc, "utc");
        return new HireTimestamp(IsoTimestamps.truncate(utc), null);
    }

    /**
     * Creates a timestamp from text that could not be parsed.
     *
     * @param text original text, kept unchanged
     * @return timestamp holding the raw text
     */
    public static HireTimestamp unparsed(String text) {
        Objects.requireNonNull(text, "text");
        return new HireTimestamp(null, text);
    }

    /**
     * Parses backup text, falling back to the raw text when it is not a recognizable ISO-8601
     * value.
     *
     * @param text ISO-8601 text
     * @return parsed or raw timestamp
     */
    public static HireTimestamp fromText(String text) {
        return IsoTimestamps.parseLenient(text).map(HireTimestamp::of)
                .orElseGet(() -> unparsed(text));
    }

    /**
     * Returns whether the value was parsed.
     *
     * @return {@code true} for a structured value
     */
    public boolean isParsed() {
        return value != null;
    }

    /**
     * Renders the value as {@code yyyy-MM-dd'T'HH:mm:ss'Z'}, or the raw text for unparsed values.
     *
     * @return text form
     */
    public String toText() {
        return isParsed() ? IsoTimestamps.format(value) : raw;
    }

    /**
     * Returns the value to bind to a TIMESTAMP column.
     *
     * @return {@link Timestamp} for parsed values, raw text otherwise (left to the store to cast)
     */
    public Object toJdbcValue() {
        return isParsed() ? Timestamp.valueOf(value) : raw;
    }

    @Override
    public String toString() {
        return toText();
    }
}
