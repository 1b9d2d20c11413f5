package com.questrail.mcumgr.observability;

import com.questrail.mcumgr.error.McuMgrException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of McuMgrObservabilitySink that emits logs via SLF4J.
 *
 * <p>Per-request traffic is logged at DEBUG, failures delivered to callers at
 * WARN, and internal anomalies at ERROR.</p>
 */
public final class Slf4jMcuMgrObservabilitySink implements McuMgrObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jMcuMgrObservabilitySink.class);

    @Override
    public void onRequestSent(McuMgrRequestEvent event) {
        log.debug("Sending {} command (version: {}, group: {}, seq: {}, id: {}, {} bytes)",
            event.operation(),
            event.version(),
            event.group(),
            event.sequenceNumber(),
            event.commandId(),
            event.packetLength());
    }

    @Override
    public void onRequestCompleted(McuMgrCompletionEvent event) {
        if (event.isSuccess()) {
            log.debug("Response ({}, group: {}, seq: {}, id: {}): {}",
                event.version(),
                event.group(),
                event.sequenceNumber(),
                event.commandId(),
                event.result().value().map(r -> r.payload().toString()).orElse(""));
            return;
        }
        log.warn("Request ({}, group: {}, seq: {}, id: {}) failed: {}",
            event.version(),
            event.group(),
            event.sequenceNumber(),
            event.commandId(),
            event.result().error().map(McuMgrException::getMessage).orElse("unknown"));
    }

    @Override
    public void onMtuChanged(int oldMtu, int newMtu) {
        log.info("MTU set to {} (was {})", newMtu, oldMtu);
    }

    @Override
    public void onTransportEvent(McuMgrTransportEvent event) {
        switch (event.kind()) {
            case TRANSPORT_UP, TRANSPORT_DOWN -> log.info("SMP transport event: {} {}", event.kind(), event.detail());
            default -> log.warn("SMP transport event: {} {}", event.kind(), event.detail());
        }
    }

    @Override
    public void onError(McuMgrErrorEvent event) {
        log.error("SMP client error: {}", event.message(), event.cause());
    }
}
