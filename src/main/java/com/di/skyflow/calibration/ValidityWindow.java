package com.di.skyflow.calibration;

import com.di.skyflow.util.TimeBase;

/**
 * Half-open interval {@code [start, end)} in MJD. Windows that only touch do not overlap.
 */
public record ValidityWindow(double start, double end) {

    /**
     * Window of {@code ±halfWidthHours} around a transit.
     */
    public static ValidityWindow centeredOn(double transitMjd, double halfWidthHours) {
        double half = TimeBase.hoursToDays(halfWidthHours);
        return new ValidityWindow(transitMjd - half, transitMjd + half);
    }

    public boolean isValid() {
        return Double.isFinite(start) && Double.isFinite(end) && start < end;
    }

    public boolean contains(double t) {
        return t >= start && t < end;
    }

    public boolean overlaps(ValidityWindow other) {
        return start < other.end && other.start < end;
    }

    public double midpoint() {
        return (start + end) / 2.0;
    }
}
