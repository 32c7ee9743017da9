package com.questrail.plc.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for scan-cycle pacing and cycle duration measurement.
 *
 * <h2>Binding invariant</h2>
 * All cycle timing (period pacing, overrun detection, startup delays) MUST use
 * a monotonic time source. Wall-clock time is permitted only for observability
 * timestamps.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
