package com.di.skyflow.ingest;

/**
 * What happened to one arrival and the group it was routed to.
 */
public record ArrivalResult(ArrivalOutcome outcome, String groupId, int memberCount, String detail) {

    public static ArrivalResult of(ArrivalOutcome outcome, String groupId, int memberCount) {
        return new ArrivalResult(outcome, groupId, memberCount, null);
    }
}
