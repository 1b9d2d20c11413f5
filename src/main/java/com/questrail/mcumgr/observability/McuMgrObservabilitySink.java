package com.questrail.mcumgr.observability;

/**
 * Receives observability events from managers and transports.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Methods are called synchronously from protocol code paths, some of them
 * while a manager's lock is held. Implementations must be thread-safe and
 * must not block.</p>
 */
public interface McuMgrObservabilitySink {
    /**
     * Called after a request packet was built and before it is handed to the transport.
     */
    void onRequestSent(McuMgrRequestEvent event);

    /**
     * Called for every delivered outcome, in issue order, just before the caller's callback.
     */
    void onRequestCompleted(McuMgrCompletionEvent event);

    /**
     * Called when the MTU of a manager changes.
     */
    void onMtuChanged(int oldMtu, int newMtu);

    /**
     * Called when a transport-level event occurs (e.g., transport up/down, late datagram).
     */
    void onTransportEvent(McuMgrTransportEvent event);

    /**
     * Called when an error or anomaly occurs inside the client.
     */
    void onError(McuMgrErrorEvent event);
}
