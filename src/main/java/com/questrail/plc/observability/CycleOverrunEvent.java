package com.questrail.plc.observability;

import java.time.Duration;
import java.time.Instant;

/**
 * Record emitted when a scan iteration takes longer than the scan period.
 */
public record CycleOverrunEvent(
    Instant timestamp,
    long cycleNumber,
    Duration elapsed,
    Duration scanPeriod
) {
    /**
     * How far past the period the iteration ran.
     */
    public Duration overrunBy() {
        return elapsed.minus(scanPeriod);
    }
}
