package com.questrail.plc.time;

import java.time.Duration;

/**
 * Sleeper
 * -----------------------------------------------------------------------------
 * Suspends the calling thread. Exists so the scan loop's pacing can be driven
 * by a test double instead of the real scheduler.
 */
@FunctionalInterface
public interface Sleeper
{
    /**
     * Blocks for at least the given duration. Zero or negative durations return
     * immediately.
     *
     * @throws InterruptedException if the thread is interrupted while waiting;
     *         this is how a stop request cuts a pacing sleep short
     */
    void sleep(Duration duration) throws InterruptedException;
}
