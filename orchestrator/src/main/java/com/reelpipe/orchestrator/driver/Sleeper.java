package com.reelpipe.orchestrator.driver;

import java.time.Duration;

/** Waits between ticks. Replaced in tests so backoff can be observed without real delays. */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = d -> Thread.sleep(d.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
