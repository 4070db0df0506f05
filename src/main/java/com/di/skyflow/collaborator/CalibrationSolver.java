package com.di.skyflow.collaborator;

import com.di.skyflow.calibration.CalibrationTable;
import com.di.skyflow.common.Result;

import java.util.List;

/**
 * Derives solution tables from a calibrator observation.
 */
public interface CalibrationSolver {

    Result<List<CalibrationTable>> solve(String observationRef, String referenceField, String referenceAntenna);
}
