package com.di.skyflow.collaborator;

import java.util.List;

/**
 * One calibration set to apply, its tables in apply order and its interpolation weight.
 */
public record WeightedCalibration(String setName, List<String> tablePaths, double weight) {
}
