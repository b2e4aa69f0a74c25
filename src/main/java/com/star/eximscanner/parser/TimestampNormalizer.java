package com.star.eximscanner.parser;

import com.star.eximscanner.exception.InvalidTimestampException;
import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Turns the date and time fields of a record into an {@link Instant}.
 *
 * <p>Fields are taken as they are: no missing year is guessed and nothing
 * out of calendar range is rolled over.
 */
@Slf4j
public class TimestampNormalizer {

    public Instant normalize(ParsedRecord record, ZoneId zone) {
        return normalize(record.getYear(), record.getMonth(), record.getDay(),
                record.getHour(), record.getMinute(), record.getSecond(), zone);
    }

    /**
     * @throws InvalidTimestampException if the fields do not form a valid
     *         date and time
     */
    public Instant normalize(int year, int month, int day,
                             int hour, int minute, int second, ZoneId zone) {
        LocalDateTime local;
        try {
            local = LocalDateTime.of(year, month, day, hour, minute, second);
        } catch (DateTimeException e) {
            throw new InvalidTimestampException(year, month, day, hour, minute, second, e);
        }

        ZoneId effectiveZone = zone != null ? zone : ZoneOffset.UTC;
        // Local times inside a DST gap are shifted forward by the length of the gap.
        Instant instant = local.atZone(effectiveZone).toInstant();
        log.trace("Normalized {} in {} to {}", local, effectiveZone, instant);
        return instant;
    }
}
