package com.questrail.plc.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the PLC runtime.
 */
public record PlcErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
