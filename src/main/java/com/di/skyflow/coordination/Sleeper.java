package com.di.skyflow.coordination;

import java.time.Duration;

/**
 * Blocking wait used between retries and lock polls.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = d -> Thread.sleep(d.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
