package com.di.skyflow.collaborator;

import com.di.skyflow.common.Result;

import java.util.List;

/**
 * Applies one or two weighted calibration sets to an observation in place.
 */
public interface CalibrationApplier {

    Result<Void> apply(String observationRef, List<WeightedCalibration> calibrations);
}
