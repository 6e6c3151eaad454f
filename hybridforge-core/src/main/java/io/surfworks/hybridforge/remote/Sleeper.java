package io.surfworks.hybridforge.remote;

import java.time.Duration;

/**
 * Pauses the calling thread between connection attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
