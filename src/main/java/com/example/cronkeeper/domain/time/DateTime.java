package com.example.cronkeeper.domain.time;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Absolute point in time, kept both as calendar fields and as epoch seconds.
 * <p>
 * Instances are only created through the factory methods, which derive
 * {@code timestamp} from the calendar fields, so the two always agree.
 * Local times that fall into a DST overlap resolve to the earlier instant;
 * local times inside a DST gap do not exist and yield {@link Optional#empty()}.
 */
@Slf4j
@Value
@Jacksonized
@Builder(access = AccessLevel.PACKAGE)
public class DateTime {

    int year;
    int month;
    int day;
    int hour;
    int min;
    int sec;
    long timestamp;
    TimeZone timeZone;

    public static DateTime now() {
        return now(Clock.systemDefaultZone());
    }

    static DateTime now(Clock clock) {
        var zone = new TimeZone.Local();
        return fromZoned(ZonedDateTime.ofInstant(clock.instant(), zone.toZoneId()), zone);
    }

    /**
     * Now plus one day, used when a one-shot timer is requested without a time.
     */
    public static DateTime oneDay() {
        return now().plus(Duration.oneDay())
                .orElseThrow(() -> new IllegalStateException("Cannot compute the time one day from now"));
    }

    public static Optional<DateTime> of(int year, int month, int day, int hour, int min, int sec) {
        return of(year, month, day, hour, min, sec, new TimeZone.Local());
    }

    public static Optional<DateTime> of(int year, int month, int day, int hour, int min, int sec, TimeZone timeZone) {
        LocalDateTime local;
        try {
            local = LocalDateTime.of(year, month, day, hour, min, sec);
        } catch (DateTimeException e) {
            log.error("Calendar fields {}-{}-{} {}:{}:{} do not name a valid date: {}",
                    year, month, day, hour, min, sec, e.getMessage());
            return Optional.empty();
        }
        return resolve(local, timeZone.toZoneId()).map(zoned -> fromZoned(zoned, timeZone));
    }

    /**
     * Maps a local date-time onto the zone's timeline. Overlaps pick the earlier
     * instant, gaps have no mapping.
     */
    static Optional<ZonedDateTime> resolve(LocalDateTime local, ZoneId zone) {
        var offsets = zone.getRules().getValidOffsets(local);
        if (offsets.isEmpty()) {
            log.error("Local time {} does not exist in zone {}", local, zone);
            return Optional.empty();
        }
        if (offsets.size() > 1) {
            log.debug("Local time {} is ambiguous in zone {}, offsets {}; using the earlier instant", local, zone, offsets);
        }
        return Optional.of(ZonedDateTime.ofLocal(local, zone, null).withEarlierOffsetAtOverlap());
    }

    /**
     * Adds the duration field by field with fixed-length months (30 days) and
     * years (365 days), then re-derives the calendar fields from the resulting
     * instant.
     */
    public Optional<DateTime> plus(Duration duration) {
        var zone = timeZone.toZoneId();
        return resolve(toLocalDateTime(), zone)
                .flatMap(start -> {
                    LocalDateTime end;
                    try {
                        end = start.toInstant()
                                .plusSeconds(duration.getSec())
                                .plusSeconds(duration.getMin() * Duration.SECONDS_PER_MINUTE)
                                .plusSeconds(duration.getHour() * Duration.SECONDS_PER_HOUR)
                                .plusSeconds(duration.getDay() * Duration.SECONDS_PER_DAY)
                                .plusSeconds(duration.getMonth() * 30L * Duration.SECONDS_PER_DAY)
                                .plusSeconds(duration.getYear() * 365L * Duration.SECONDS_PER_DAY)
                                .atZone(zone)
                                .toLocalDateTime();
                    } catch (DateTimeException | ArithmeticException e) {
                        log.error("Adding {} to {} overflows: {}", duration, this, e.getMessage());
                        return Optional.empty();
                    }
                    return of(end.getYear(), end.getMonthValue(), end.getDayOfMonth(),
                            end.getHour(), end.getMinute(), end.getSecond(), timeZone);
                });
    }

    @JsonIgnore
    public boolean isUp() {
        return isUp(Instant.now());
    }

    public boolean isUp(Instant now) {
        return timestamp <= now.getEpochSecond();
    }

    public LocalDateTime toLocalDateTime() {
        return LocalDateTime.of(year, month, day, hour, min, sec);
    }

    private static DateTime fromZoned(ZonedDateTime zoned, TimeZone timeZone) {
        return new DateTime(zoned.getYear(), zoned.getMonthValue(), zoned.getDayOfMonth(),
                zoned.getHour(), zoned.getMinute(), zoned.getSecond(),
                zoned.toEpochSecond(), timeZone);
    }
}
