package com.beacon.notification.common.messaging;

import java.time.Duration;

/**
 * Blocking wait used between in-process retries. Interruption ends the wait early.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
