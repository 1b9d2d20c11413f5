package com.questrail.mcumgr.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the client itself (as opposed to
 * an error reported by the device).
 */
public record McuMgrErrorEvent(
        Instant timestamp,
        String message,
        Throwable cause
) {
}
