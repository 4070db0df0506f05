package com.di.skyflow.calibration;

public enum CalibrationStatus {
    ACTIVE,
    /** Terminal. A retired set is never returned by a lookup. */
    RETIRED
}
