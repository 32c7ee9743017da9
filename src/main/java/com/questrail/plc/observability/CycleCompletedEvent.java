package com.questrail.plc.observability;

import com.questrail.plc.core.exec.CycleReport;

import java.time.Instant;
import java.util.Objects;

/**
 * Record emitted once per completed scan iteration.
 */
public record CycleCompletedEvent(
    Instant timestamp,
    CycleReport report,
    boolean plantConnected
) {
    public CycleCompletedEvent {
        Objects.requireNonNull(report, "report");
    }
}
