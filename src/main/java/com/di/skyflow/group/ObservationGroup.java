package com.di.skyflow.group;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * A bucket of subband files for one observing interval, and everything the pipeline has
 * produced for it so far. Persisted in {@code observation_groups} / {@code group_members}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ObservationGroup {

    private String groupId;
    private GroupState state;
    private int expectedCount;
    /** Bucket time in MJD. */
    private double observedMjd;
    private Instant createdAt;
    private Instant updatedAt;
    private int retryCount;

    /** Converted measurement-set reference. */
    private String outputPath;
    /** Image product reference. */
    private String imagePath;

    private String errorMessage;
    private GroupState failedStage;
    private boolean retryable;

    /** Set when the group observes a calibrator transit. */
    private String calibratorName;
    private Double transitMjd;
    @Builder.Default
    private CalibrationState calibrationState = CalibrationState.NOT_ATTEMPTED;
    /** Comma-separated calibration set names applied to the group. */
    private String calibrationSets;

    private long rowVersion;

    @Builder.Default
    private List<GroupMember> members = new ArrayList<>();

    public boolean isCalibrator() {
        return calibratorName != null;
    }

    public Set<Integer> memberIndices() {
        Set<Integer> indices = new TreeSet<>();
        for (GroupMember m : members) {
            indices.add(m.getSubbandIndex());
        }
        return indices;
    }

    /** Complete when every index {@code 0..expectedCount-1} is present. */
    public boolean isComplete() {
        return memberIndices().size() == expectedCount;
    }

    public List<GroupMember> membersInOrder() {
        List<GroupMember> sorted = new ArrayList<>(members);
        sorted.sort(Comparator.comparingInt(GroupMember::getSubbandIndex));
        return sorted;
    }
}
