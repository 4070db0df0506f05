package com.di.skyflow.common;

/**
 * Classification of a failed operation. Drives the orchestrator's retry decision.
 */
public enum FailureKind {

    /** Bad input or unmet precondition. Never retried. */
    VALIDATION,

    /** Temporary condition (lock contention, busy resource, timeout). Retried with backoff. */
    TRANSIENT,

    /** Unrecoverable for this input. Recorded and left for an operator. */
    FATAL;

    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}
