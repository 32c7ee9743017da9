package com.questrail.plc.time;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Production {@link Sleeper} backed by {@link TimeUnit#sleep(long)}.
 */
public enum ThreadSleeper implements Sleeper {
    INSTANCE;

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        long nanos = duration.toNanos();
        if (nanos > 0) {
            TimeUnit.NANOSECONDS.sleep(nanos);
        }
    }
}
