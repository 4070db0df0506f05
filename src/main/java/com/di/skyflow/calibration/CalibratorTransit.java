package com.di.skyflow.calibration;

/**
 * A calibrator source transiting during an observation.
 */
public record CalibratorTransit(String calibratorName, double transitMjd, String referenceField, String referenceAntenna) {
}
