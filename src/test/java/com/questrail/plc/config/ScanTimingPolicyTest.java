package com.questrail.plc.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ScanTimingPolicyTest {

    @Test
    void defaults() {
        ScanTimingPolicy p = ScanTimingPolicy.defaults();

        assertEquals(Duration.ofMillis(100), p.scanPeriod());
        assertEquals(Duration.ofSeconds(2), p.plantStartupDelay());
        assertEquals(Duration.ofSeconds(1), p.plantIoTimeout());
        assertEquals(Duration.ofSeconds(5), p.shutdownTimeout());
    }

    @Test
    void withersReplaceOneField() {
        ScanTimingPolicy p = ScanTimingPolicy.defaults()
                .withScanPeriod(Duration.ofMillis(50))
                .withPlantStartupDelay(Duration.ZERO);

        assertEquals(Duration.ofMillis(50), p.scanPeriod());
        assertEquals(Duration.ZERO, p.plantStartupDelay());
        assertEquals(Duration.ofSeconds(1), p.plantIoTimeout());
    }

    @Test
    void rejectsNonPositivePeriodAndTimeout() {
        assertThrows(IllegalArgumentException.class,
                () -> ScanTimingPolicy.defaults().withScanPeriod(Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new ScanTimingPolicy(Duration.ofMillis(100), Duration.ZERO, Duration.ZERO, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> ScanTimingPolicy.defaults().withPlantStartupDelay(Duration.ofMillis(-1)));
    }
}
