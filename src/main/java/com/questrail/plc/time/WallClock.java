package com.questrail.plc.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly for observability timestamps.
 *
 * <p>
 * This clock may jump due to DST, NTP adjustments, or explicit time setting.
 * It MUST NOT be used for scan pacing or timeouts.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
