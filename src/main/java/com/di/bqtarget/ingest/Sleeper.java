package com.di.bqtarget.ingest;

import java.time.Duration;

/**
 * Blocking wait used for the post-recreation cool-down of streaming inserts.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
