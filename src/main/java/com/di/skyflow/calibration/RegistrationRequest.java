package com.di.skyflow.calibration;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Input to {@link CalibrationRegistry#register}.
 */
@Value
@Builder
public class RegistrationRequest {
    String setName;
    @Singular
    List<CalibrationTable> tables;
    double validStart;
    double validEnd;
    String referenceField;
    String referenceAntenna;
    String sourceObservation;
    String notes;
    @Singular("qualityMetric")
    Map<String, Double> qualityMetrics;

    public ValidityWindow window() {
        return new ValidityWindow(validStart, validEnd);
    }
}
