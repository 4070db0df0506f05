package com.di.skyflow.util;

import java.time.Instant;

/**
 * Conversions between {@link Instant} and Modified Julian Date, the time base shared by
 * observation timestamps and calibration validity windows.
 */
public final class TimeBase {

    /** MJD of the Unix epoch (1970-01-01T00:00:00Z). */
    public static final double UNIX_EPOCH_MJD = 40587.0;
    public static final double SECONDS_PER_DAY = 86_400.0;
    public static final double HOURS_PER_DAY = 24.0;

    private TimeBase() {
    }

    public static double toMjd(Instant instant) {
        double seconds = instant.getEpochSecond() + instant.getNano() / 1e9;
        return seconds / SECONDS_PER_DAY + UNIX_EPOCH_MJD;
    }

    public static Instant fromMjd(double mjd) {
        double seconds = (mjd - UNIX_EPOCH_MJD) * SECONDS_PER_DAY;
        long whole = (long) Math.floor(seconds);
        long nanos = Math.round((seconds - whole) * 1e9);
        if (nanos >= 1_000_000_000L) {
            whole += 1;
            nanos -= 1_000_000_000L;
        }
        return Instant.ofEpochSecond(whole, nanos);
    }

    public static double hoursToDays(double hours) {
        return hours / HOURS_PER_DAY;
    }

    public static double daysToHours(double days) {
        return days * HOURS_PER_DAY;
    }
}
