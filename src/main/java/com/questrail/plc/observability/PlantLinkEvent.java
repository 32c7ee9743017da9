package com.questrail.plc.observability;

import java.time.Instant;

/**
 * Record representing a change in the connection to the plant.
 *
 * <p>{@code cause} is null for {@link Kind#CONNECTED}.</p>
 */
public record PlantLinkEvent(
    Instant timestamp,
    Kind kind,
    String remote,
    Throwable cause
) {
    public enum Kind {
        CONNECTED,
        CONNECT_FAILED,
        DROPPED
    }
}
