package com.koni.historyinjector.application.ingest;

import com.koni.historyinjector.domain.exception.InvalidTimestampException;
import com.koni.historyinjector.domain.exception.TimestampOutOfWindowException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.function.Function;

/**
 * Parses record timestamps and checks them against the freshness window
 * {@code [now - maxTimestampOffsetDays, now + clockSkewTolerance]}, inclusive at both ends.
 *
 * Accepted forms: ISO-8601 with {@code Z} or an offset, zone-less date-times (read as UTC),
 * a space instead of {@code T}, optional fractional seconds, and plain dates (midnight UTC).
 */
@Component
public class TimestampValidator {

    static final int MIN_OFFSET_DAYS = 1;
    static final int MAX_OFFSET_DAYS = 365;

    private static final List<Function<String, Instant>> PARSERS = List.of(
            text -> OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant(),
            text -> LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC),
            text -> LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay().toInstant(ZoneOffset.UTC)
    );

    private final Clock clock;
    private final Duration maxAge;
    private final Duration clockSkewTolerance;

    public TimestampValidator(
            Clock clock,
            @Value("${injector.max-timestamp-offset-days:30}") int maxTimestampOffsetDays,
            @Value("${injector.clock-skew-tolerance:0s}") Duration clockSkewTolerance) {
        if (maxTimestampOffsetDays < MIN_OFFSET_DAYS || maxTimestampOffsetDays > MAX_OFFSET_DAYS) {
            throw new IllegalArgumentException("injector.max-timestamp-offset-days must be between "
                    + MIN_OFFSET_DAYS + " and " + MAX_OFFSET_DAYS + ", was " + maxTimestampOffsetDays);
        }
        if (clockSkewTolerance.isNegative()) {
            throw new IllegalArgumentException("injector.clock-skew-tolerance must not be negative");
        }
        this.clock = clock;
        this.maxAge = Duration.ofDays(maxTimestampOffsetDays);
        this.clockSkewTolerance = clockSkewTolerance;
    }

    /**
     * Parses the timestamp and checks it against the window.
     *
     * @param rawTimestamp the timestamp as received
     * @return the parsed instant, truncated to microseconds like Home Assistant's own timestamps
     * @throws InvalidTimestampException if the text cannot be parsed
     * @throws TimestampOutOfWindowException if the instant is too old or too far in the future
     */
    public Instant validate(String rawTimestamp) {
        // the store keeps epoch seconds as a double, which cannot tell sub-microsecond instants apart
        Instant timestamp = parse(rawTimestamp).truncatedTo(ChronoUnit.MICROS);
        Instant now = clock.instant();
        Instant oldest = now.minus(maxAge);
        Instant newest = now.plus(clockSkewTolerance);
        if (timestamp.isBefore(oldest) || timestamp.isAfter(newest)) {
            throw new TimestampOutOfWindowException("Timestamp " + timestamp + " is outside the accepted window ["
                    + oldest + ", " + newest + "]");
        }
        return timestamp;
    }

    /**
     * @throws InvalidTimestampException if the text matches none of the accepted forms
     */
    public Instant parse(String rawTimestamp) {
        if (rawTimestamp == null || rawTimestamp.isBlank()) {
            throw new InvalidTimestampException("Timestamp is empty");
        }
        String text = rawTimestamp.trim();
        if (text.length() > 10 && text.charAt(10) == ' ') {
            text = text.substring(0, 10) + 'T' + text.substring(11);
        }
        DateTimeParseException lastFailure = null;
        for (Function<String, Instant> parser : PARSERS) {
            try {
                return parser.apply(text);
            } catch (DateTimeParseException e) {
                lastFailure = e;
            }
        }
        throw new InvalidTimestampException("Could not parse timestamp '" + rawTimestamp + "'", lastFailure);
    }
}
