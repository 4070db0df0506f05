package com.di.skyflow.calibration;

import java.util.ArrayList;
import java.util.List;

/**
 * Sets to apply for one observation time and their weights. Weights of the returned sets
 * sum to 1; an empty result means no set was within range.
 *
 * @param before          set whose reference time is at or before the observation, or null
 * @param after           set whose reference time is after the observation, or null
 * @param method          how the sets were chosen
 * @param timeOffsetHours distance from the observation to the nearest chosen reference time
 * @param qualityScore    {@code 1 - offset / (2 * validity)}, clamped to {@code [0, 1]}
 * @param warnings        conditions an operator should see, such as a large gap between sets
 */
public record InterpolationResult(CalibrationSet before, CalibrationSet after,
                                  double weightBefore, double weightAfter,
                                  SelectionMethod method, double timeOffsetHours, double qualityScore,
                                  List<String> warnings) {

    public InterpolationResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static InterpolationResult empty() {
        return new InterpolationResult(null, null, 0.0, 0.0, SelectionMethod.NONE, 0.0, 0.0, List.of());
    }

    public boolean interpolated() {
        return method == SelectionMethod.INTERPOLATED;
    }

    public boolean isEmpty() {
        return before == null && after == null;
    }

    /** The one set of a non-interpolated result. */
    public CalibrationSet single() {
        return before != null ? before : after;
    }

    public List<CalibrationSet> sets() {
        List<CalibrationSet> sets = new ArrayList<>(2);
        if (before != null) {
            sets.add(before);
        }
        if (after != null) {
            sets.add(after);
        }
        return sets;
    }
}
