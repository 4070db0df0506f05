package com.di.skyflow.orchestration;

import com.di.skyflow.calibration.CalibratorTransit;
import com.di.skyflow.group.CalibrationState;

import java.util.List;

/**
 * What the calibration stage did to a group.
 *
 * @param setNames sets applied, in apply order
 * @param transit  set for calibrator groups only
 */
public record CalibrationOutcome(CalibrationState state, List<String> setNames, List<Double> weights,
                                 CalibratorTransit transit) {

    public static CalibrationOutcome uncalibrated() {
        return new CalibrationOutcome(CalibrationState.UNCALIBRATED, List.of(), List.of(), null);
    }

    public boolean isDegraded() {
        return state == CalibrationState.UNCALIBRATED;
    }

    public String joinedSetNames() {
        return setNames.isEmpty() ? null : String.join(",", setNames);
    }
}
