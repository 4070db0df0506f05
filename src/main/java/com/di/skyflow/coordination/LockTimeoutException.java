package com.di.skyflow.coordination;

import lombok.Getter;

import java.time.Duration;

/**
 * The lock could not be acquired before the timeout. Transient by nature.
 */
@Getter
public class LockTimeoutException extends RuntimeException {

    private final String key;
    private final Duration timeout;

    public LockTimeoutException(String key, Duration timeout) {
        super("Timed out after " + timeout.toMillis() + " ms waiting for lock '" + key + "'");
        this.key = key;
        this.timeout = timeout;
    }
}
