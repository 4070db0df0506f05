package com.di.skyflow.calibration;

import java.util.Optional;

/**
 * Nearest active sets on either side of a time, by window midpoint.
 */
public record BidirectionalLookup(Optional<CalibrationSet> before, Optional<CalibrationSet> after) {

    public boolean isEmpty() {
        return before.isEmpty() && after.isEmpty();
    }
}
