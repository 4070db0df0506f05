package com.di.skyflow.calibration;

/**
 * Failure codes returned by {@link CalibrationRegistry}.
 */
public final class RegistryErrorCode {

    public static final String INVALID_WINDOW = "INVALID_WINDOW";
    public static final String DUPLICATE_SET_NAME = "DUPLICATE_SET_NAME";
    public static final String INVALID_NAME = "INVALID_NAME";
    public static final String EMPTY_SET = "EMPTY_SET";
    public static final String DISCOVERABILITY_FAILED = "DISCOVERABILITY_FAILED";
    public static final String UNKNOWN_SET = "UNKNOWN_SET";

    private RegistryErrorCode() {
    }
}
