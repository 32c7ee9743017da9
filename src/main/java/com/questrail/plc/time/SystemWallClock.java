package com.questrail.plc.time;

import java.time.Instant;

/**
 * Production {@link WallClock} backed by {@link Instant#now()}.
 *
 * <p><strong>Do not use for operational timing.</strong> Cycle pacing uses
 * {@link MonotonicClock} exclusively.</p>
 */
public enum SystemWallClock implements WallClock {
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
