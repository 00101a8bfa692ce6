package com.reference.matching.ratelimit;

import java.time.Duration;

/**
 * Suspends the calling thread. Replaced in tests by a sleeper that advances a fake clock.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);

    void sleep(Duration duration) throws InterruptedException;
}
