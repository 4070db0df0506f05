package com.di.skyflow.calibration;

import lombok.Value;

/**
 * One solution table of a set. {@code orderIndex} is its position in the apply list.
 */
@Value
public class CalibrationTable {
    CalTableKind kind;
    String path;
    int orderIndex;

    public static CalibrationTable of(CalTableKind kind, String path) {
        return new CalibrationTable(kind, path, kind.getApplyOrder());
    }

    public CalibrationTable withOrderIndex(int index) {
        return new CalibrationTable(kind, path, index);
    }
}
