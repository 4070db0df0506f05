package com.di.skyflow.group;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of an {@link ObservationGroup}. A processing state names the stage the group is
 * currently in; leaving it means the stage finished.
 *
 * <pre>
 * COLLECTING → PENDING → CONVERTING → CALIBRATING → IMAGING → MOSAICKING → COMPLETED
 *      └──────────┴───────────┴────────────┴───────────┴──────────┴──→ FAILED
 * FAILED → (retry) the stage that failed
 * </pre>
 */
public enum GroupState {

    COLLECTING,
    PENDING,
    CONVERTING,
    CALIBRATING,
    IMAGING,
    MOSAICKING,
    COMPLETED,
    FAILED;

    private static final Map<GroupState, Set<GroupState>> SUCCESSORS = new EnumMap<>(GroupState.class);

    static {
        SUCCESSORS.put(COLLECTING, EnumSet.of(PENDING, FAILED));
        SUCCESSORS.put(PENDING, EnumSet.of(CONVERTING, FAILED));
        SUCCESSORS.put(CONVERTING, EnumSet.of(CALIBRATING, FAILED));
        SUCCESSORS.put(CALIBRATING, EnumSet.of(IMAGING, FAILED));
        SUCCESSORS.put(IMAGING, EnumSet.of(MOSAICKING, FAILED));
        SUCCESSORS.put(MOSAICKING, EnumSet.of(COMPLETED, FAILED));
        SUCCESSORS.put(COMPLETED, EnumSet.noneOf(GroupState.class));
        SUCCESSORS.put(FAILED, EnumSet.of(CONVERTING, CALIBRATING, IMAGING, MOSAICKING));
    }

    public Set<GroupState> successors() {
        return Collections.unmodifiableSet(SUCCESSORS.get(this));
    }

    /** Same-state moves are allowed and treated as no-ops. */
    public boolean canTransitionTo(GroupState target) {
        return this == target || SUCCESSORS.get(this).contains(target);
    }

    /** True for the four states in which a stage runs. */
    public boolean isProcessing() {
        return this == CONVERTING || this == CALIBRATING || this == IMAGING || this == MOSAICKING;
    }

    public boolean isTerminal() {
        return this == COMPLETED;
    }

    /** Position along the happy path; FAILED has none. */
    public int pipelineOrder() {
        return this == FAILED ? -1 : ordinal();
    }

    /** True when this state lies strictly after {@code other} on the happy path. */
    public boolean isPast(GroupState other) {
        return this != FAILED && other != FAILED && ordinal() > other.ordinal();
    }
}
