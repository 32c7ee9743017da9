package com.questrail.plc.runtime;

import java.time.Duration;
import java.util.Objects;

/**
 * Snapshot of the scan loop, replaced after every iteration.
 *
 * <p>{@code lastCycleDuration} covers the whole iteration (command pull, plant
 * I/O, logic, publish), not just the logic.</p>
 */
public record ScanState(
    long cycleCount,
    Duration lastCycleDuration,
    boolean systemEnabled,
    boolean running,
    boolean programLoaded,
    boolean alarmActive
) {
    public ScanState {
        Objects.requireNonNull(lastCycleDuration, "lastCycleDuration");
    }

    public static ScanState initial(boolean programLoaded) {
        return new ScanState(0, Duration.ZERO, false, false, programLoaded, false);
    }

    public ScanState withRunning(boolean running) {
        return new ScanState(cycleCount, lastCycleDuration, systemEnabled, running, programLoaded, alarmActive);
    }
}
