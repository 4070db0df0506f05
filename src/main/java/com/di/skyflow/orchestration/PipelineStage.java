package com.di.skyflow.orchestration;

import com.di.skyflow.group.GroupState;

/**
 * The four processing stages, the state a group is in while the stage runs, and the state
 * it moves to when the stage succeeds.
 */
public enum PipelineStage {

    CONVERT(GroupState.CONVERTING, GroupState.CALIBRATING),
    CALIBRATE(GroupState.CALIBRATING, GroupState.IMAGING),
    IMAGE(GroupState.IMAGING, GroupState.MOSAICKING),
    MOSAIC(GroupState.MOSAICKING, GroupState.COMPLETED);

    private final GroupState activeState;
    private final GroupState nextState;

    PipelineStage(GroupState activeState, GroupState nextState) {
        this.activeState = activeState;
        this.nextState = nextState;
    }

    public GroupState activeState() {
        return activeState;
    }

    public GroupState nextState() {
        return nextState;
    }

    /**
     * Stage a group in {@code state} runs next; null when there is none (collecting,
     * completed or failed).
     */
    public static PipelineStage forState(GroupState state) {
        if (state == GroupState.PENDING) {
            return CONVERT;
        }
        for (PipelineStage s : values()) {
            if (s.activeState == state) {
                return s;
            }
        }
        return null;
    }

    /** True when a group in {@code state} may start or resume this stage. */
    public boolean canStartFrom(GroupState state) {
        return state == activeState || (this == CONVERT && state == GroupState.PENDING);
    }

    /** True when a group in {@code state} has already finished this stage. */
    public boolean isDoneIn(GroupState state) {
        return state == GroupState.COMPLETED || state.isPast(activeState);
    }
}
