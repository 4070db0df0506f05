package com.di.skyflow.ingest;

public enum ArrivalOutcome {
    /** Stored; the group still misses members. */
    ACCEPTED,
    /** Stored and the group now holds every expected subband. */
    GROUP_COMPLETE,
    /** Same file seen before. Dropped. */
    DUPLICATE_IGNORED,
    /** Different file for an index the group already holds. First one wins. */
    DUPLICATE_MEMBER,
    /** Subband index outside {@code 0..expected-1}. */
    INVALID_INDEX;

    public boolean isStored() {
        return this == ACCEPTED || this == GROUP_COMPLETE;
    }
}
