package com.di.skyflow.group;

import lombok.Getter;

/**
 * Thrown when a transition is not in the lifecycle table. Always a programming or
 * operator error, never retried.
 */
@Getter
public class IllegalStateTransitionException extends RuntimeException {

    private final String groupId;
    private final GroupState from;
    private final GroupState to;

    public IllegalStateTransitionException(String groupId, GroupState from, GroupState to) {
        super("Illegal transition for group " + groupId + ": " + from + " -> " + to);
        this.groupId = groupId;
        this.from = from;
        this.to = to;
    }
}
