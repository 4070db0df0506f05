package com.di.skyflow.orchestration;

public enum StageOutcome {
    SUCCEEDED,
    /** Succeeded without calibration. */
    DEGRADED,
    /** The stage had already run; stored outputs returned, nothing invoked. */
    ALREADY_DONE,
    /** Group not in a state that can run this stage, or another worker owns it. */
    NOT_READY,
    FAILED_RETRYABLE,
    FAILED_FATAL;

    public boolean isSuccess() {
        return this == SUCCEEDED || this == DEGRADED || this == ALREADY_DONE;
    }

    public boolean advanced() {
        return this == SUCCEEDED || this == DEGRADED;
    }
}
