package com.example.cronkeeper.domain.time;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Calendar offset used by repeating timers.
 * <p>
 * Fields are kept denormalized as the user entered them. {@code totalSec} is an
 * informational approximation (30-day month, 360-day year); addition to a
 * {@link DateTime} always goes through the individual fields.
 */
@Value
@Jacksonized
@Builder(access = AccessLevel.PACKAGE)
public class Duration {

    static final long SECONDS_PER_MINUTE = 60L;
    static final long SECONDS_PER_HOUR = 3_600L;
    static final long SECONDS_PER_DAY = 86_400L;
    static final long APPROX_SECONDS_PER_MONTH = 2_592_000L;
    static final long APPROX_SECONDS_PER_YEAR = 31_104_000L;

    int year;
    int month;
    int day;
    int hour;
    int min;
    int sec;
    long totalSec;

    public static Duration of(int year, int month, int day, int hour, int min, int sec) {
        var totalSec = sec
                + min * SECONDS_PER_MINUTE
                + hour * SECONDS_PER_HOUR
                + day * SECONDS_PER_DAY
                + month * APPROX_SECONDS_PER_MONTH
                + year * APPROX_SECONDS_PER_YEAR;
        return new Duration(year, month, day, hour, min, sec, totalSec);
    }

    public static Duration ofDays(int days) {
        return of(0, 0, days, 0, 0, 0);
    }

    public static Duration oneDay() {
        return ofDays(1);
    }
}
