package com.di.skyflow.coordination;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A held lock. Released on {@link #close()}, on every exit path when used in
 * try-with-resources. Closing twice is harmless.
 */
@Slf4j
public final class ScopedLock implements AutoCloseable {

    private final LockRepository locks;
    private final Clock clock;
    private final String key;
    private final String token;
    private final Duration lease;
    private final AtomicBoolean released = new AtomicBoolean(false);

    ScopedLock(LockRepository locks, Clock clock, String key, String token, Duration lease) {
        this.locks = locks;
        this.clock = clock;
        this.key = key;
        this.token = token;
        this.lease = lease;
    }

    public String getKey() {
        return key;
    }

    /**
     * Extends the lease from now. Returns {@code false} if the lease was lost, in which case
     * another holder may already own the key.
     */
    public boolean renew() {
        return !released.get() && locks.renew(key, token, clock.instant().plus(lease));
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            if (!locks.release(key, token)) {
                log.warn("[LOCK] lease on '{}' had already expired or been taken over", key);
            }
        }
    }
}
