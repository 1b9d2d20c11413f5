package com.questrail.mcumgr.observability;

/**
 * No-op implementation of McuMgrObservabilitySink.
 */
public final class NullObservabilitySink implements McuMgrObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onRequestSent(McuMgrRequestEvent event) {}

    @Override
    public void onRequestCompleted(McuMgrCompletionEvent event) {}

    @Override
    public void onMtuChanged(int oldMtu, int newMtu) {}

    @Override
    public void onTransportEvent(McuMgrTransportEvent event) {}

    @Override
    public void onError(McuMgrErrorEvent event) {}
}
