package com.questrail.plc.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of PlcObservabilitySink that emits logs via SLF4J.
 *
 * <p>Per-cycle events are logged at TRACE. Overruns and link changes are
 * logged at INFO or WARN.</p>
 */
public final class Slf4jPlcObservabilitySink implements PlcObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jPlcObservabilitySink.class);

    @Override
    public void onCycleCompleted(CycleCompletedEvent event) {
        if (log.isTraceEnabled()) {
            var r = event.report();
            log.trace("Cycle {} ({}) enabled={} plant={} took {} us{}",
                r.cycleNumber(),
                r.mode(),
                r.systemEnabled(),
                event.plantConnected() ? "up" : "down",
                r.duration().toNanos() / 1_000,
                r.error().map(e -> " error=" + e.message()).orElse(""));
        }
    }

    @Override
    public void onCycleOverrun(CycleOverrunEvent event) {
        log.warn("Scan cycle {} overran: took {} ms (period {} ms)",
            event.cycleNumber(),
            event.elapsed().toMillis(),
            event.scanPeriod().toMillis());
    }

    @Override
    public void onPlantLinkEvent(PlantLinkEvent event) {
        switch (event.kind()) {
            case CONNECTED -> log.info("Connected to plant at {}", event.remote());
            case CONNECT_FAILED -> log.warn("Failed to connect to plant at {}: {}",
                event.remote(), describe(event.cause()));
            case DROPPED -> log.warn("Plant link to {} dropped: {}",
                event.remote(), describe(event.cause()));
        }
    }

    @Override
    public void onError(PlcErrorEvent event) {
        log.error("PLC Error: {}", event.message(), event.cause());
    }

    private static String describe(Throwable t) {
        if (t == null) {
            return "unknown cause";
        }
        return t.getCause() != null ? t.getMessage() + " (" + t.getCause() + ")" : t.getMessage();
    }
}
