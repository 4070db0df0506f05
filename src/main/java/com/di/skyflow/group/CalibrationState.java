package com.di.skyflow.group;

/**
 * Calibration outcome recorded on a group.
 */
public enum CalibrationState {
    NOT_ATTEMPTED,
    /** Calibrator group: solved and registered a new set, then applied it. */
    SOLVED,
    /** One existing set applied. */
    APPLIED,
    /** Two bracketing sets applied with weights. */
    INTERPOLATED,
    /** No usable set; imaged anyway and flagged for reprocessing. */
    UNCALIBRATED,
    /** Reused as mosaic overlap; calibration must be reapplied before reuse. */
    INVALIDATED
}
