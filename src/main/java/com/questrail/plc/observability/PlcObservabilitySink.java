package com.questrail.plc.observability;

/**
 * Main interface for receiving PLC runtime observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface PlcObservabilitySink {
    /**
     * Called after every scan iteration that reached the interpreter.
     * @param event the cycle outcome
     */
    void onCycleCompleted(CycleCompletedEvent event);

    /**
     * Called when an iteration exceeds the scan period.
     * @param event the overrun details
     */
    void onCycleOverrun(CycleOverrunEvent event);

    /**
     * Called when the plant connection is established, refused, or dropped.
     * @param event the link event
     */
    void onPlantLinkEvent(PlantLinkEvent event);

    /**
     * Called when an iteration fails outside the interpreter.
     * @param event the error event
     */
    void onError(PlcErrorEvent event);
}
