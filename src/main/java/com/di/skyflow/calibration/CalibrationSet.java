package com.di.skyflow.calibration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named, ordered group of solution tables valid over a time window.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CalibrationSet {

    /** Deterministic ordering for lookups: latest start, then latest creation, then name. */
    public static final Comparator<CalibrationSet> NEWEST_FIRST = Comparator
            .comparingDouble(CalibrationSet::getValidStart).reversed()
            .thenComparing(CalibrationSet::getCreatedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(CalibrationSet::getSetName, Comparator.reverseOrder());

    private String setName;
    private double validStart;
    private double validEnd;
    @Builder.Default
    private CalibrationStatus status = CalibrationStatus.ACTIVE;
    private String referenceField;
    private String referenceAntenna;
    /** Observation the tables were solved from. */
    private String sourceObservation;
    private Instant createdAt;
    private String notes;
    @Builder.Default
    private Map<String, Double> qualityMetrics = new LinkedHashMap<>();
    @Builder.Default
    private List<CalibrationTable> tables = new ArrayList<>();

    public ValidityWindow window() {
        return new ValidityWindow(validStart, validEnd);
    }

    /** Reference time used for bidirectional lookup and interpolation. */
    public double midpoint() {
        return window().midpoint();
    }

    public boolean isActive() {
        return status == CalibrationStatus.ACTIVE;
    }

    public boolean covers(double t) {
        return window().contains(t);
    }

    public List<String> orderedTablePaths() {
        List<CalibrationTable> sorted = new ArrayList<>(tables);
        sorted.sort(Comparator.comparingInt(CalibrationTable::getOrderIndex));
        List<String> paths = new ArrayList<>(sorted.size());
        for (CalibrationTable t : sorted) {
            paths.add(t.getPath());
        }
        return paths;
    }

    /** True when both sets name a reference antenna/field and they differ. */
    public boolean conflictsWith(CalibrationSet other) {
        return differs(referenceAntenna, other.referenceAntenna) || differs(referenceField, other.referenceField);
    }

    private static boolean differs(String a, String b) {
        return a != null && b != null && !Objects.equals(a, b);
    }
}
