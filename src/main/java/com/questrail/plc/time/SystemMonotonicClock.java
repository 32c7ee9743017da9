package com.questrail.plc.time;

/**
 * Production {@link MonotonicClock} backed by {@link System#nanoTime()}.
 *
 * <p>Not affected by wall-clock adjustments (NTP, DST, manual changes).
 * For deterministic tests use a manually advanced clock instead.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
