package com.questrail.plc.observability;

/**
 * No-op implementation of PlcObservabilitySink.
 */
public final class NullObservabilitySink implements PlcObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onCycleCompleted(CycleCompletedEvent event) {}

    @Override
    public void onCycleOverrun(CycleOverrunEvent event) {}

    @Override
    public void onPlantLinkEvent(PlantLinkEvent event) {}

    @Override
    public void onError(PlcErrorEvent event) {}
}
