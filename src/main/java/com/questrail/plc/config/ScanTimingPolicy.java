package com.questrail.plc.config;

import java.time.Duration;
import java.util.Objects;

/**
 * ScanTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for the scan loop and the plant link.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>scanPeriod</b>: target start-to-start interval of scan iterations.
 *       Overruns are reported, never caught up.</li>
 *   <li><b>plantStartupDelay</b>: wait before the first plant connection attempt,
 *       giving the plant simulator time to come up. Applied once.</li>
 *   <li><b>plantIoTimeout</b>: upper bound on one plant request (and on connecting).</li>
 *   <li><b>shutdownTimeout</b>: how long {@code stop()} waits for the scan thread.</li>
 * </ul>
 */
public record ScanTimingPolicy(
        Duration scanPeriod,
        Duration plantStartupDelay,
        Duration plantIoTimeout,
        Duration shutdownTimeout
) {
    public ScanTimingPolicy {
        Objects.requireNonNull(scanPeriod, "scanPeriod");
        Objects.requireNonNull(plantStartupDelay, "plantStartupDelay");
        Objects.requireNonNull(plantIoTimeout, "plantIoTimeout");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");

        if (scanPeriod.isZero() || scanPeriod.isNegative()) {
            throw new IllegalArgumentException("scanPeriod must be positive");
        }
        if (plantStartupDelay.isNegative()) {
            throw new IllegalArgumentException("plantStartupDelay must be non-negative");
        }
        if (plantIoTimeout.isZero() || plantIoTimeout.isNegative()) {
            throw new IllegalArgumentException("plantIoTimeout must be positive");
        }
        if (shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must be non-negative");
        }
    }

    /**
     * Default values:
     * <ul>
     *   <li>scanPeriod: 100ms</li>
     *   <li>plantStartupDelay: 2s</li>
     *   <li>plantIoTimeout: 1s</li>
     *   <li>shutdownTimeout: 5s</li>
     * </ul>
     */
    public static ScanTimingPolicy defaults() {
        return new ScanTimingPolicy(
                Duration.ofMillis(100),
                Duration.ofSeconds(2),
                Duration.ofSeconds(1),
                Duration.ofSeconds(5)
        );
    }

    public ScanTimingPolicy withScanPeriod(Duration scanPeriod) {
        return new ScanTimingPolicy(scanPeriod, plantStartupDelay, plantIoTimeout, shutdownTimeout);
    }

    public ScanTimingPolicy withPlantStartupDelay(Duration plantStartupDelay) {
        return new ScanTimingPolicy(scanPeriod, plantStartupDelay, plantIoTimeout, shutdownTimeout);
    }
}
