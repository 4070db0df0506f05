package com.di.skyflow.calibration;

/**
 * How an {@link InterpolationResult} picked its sets.
 */
public enum SelectionMethod {
    /** Nothing within range. */
    NONE,
    /** Sets on both sides, linearly weighted. */
    INTERPOLATED,
    /** Sets on both sides closer together than the minimum gap; the nearer one is used alone. */
    SINGLE,
    /** A set on one side only. */
    EXTRAPOLATED
}
