package com.di.skyflow.group;

import java.time.Instant;

/**
 * One row of {@code group_state_history}. {@code id} is assigned by the database.
 */
public record StateTransitionRecord(
        Long id,
        String groupId,
        GroupState fromState,
        GroupState toState,
        Instant changedAt,
        String nodeName,
        String reason) {
}
