package com.opsassistant.core.execution;

import java.time.Duration;

/**
 * Blocking wait used between retries; replaced in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
