package com.questrail.mcumgr.observability;

import java.time.Instant;

/**
 * Transport lifecycle and datagram-level anomalies.
 */
public record McuMgrTransportEvent(
        Instant timestamp,
        Kind kind,
        String detail
) {
    public enum Kind {
        TRANSPORT_UP,
        TRANSPORT_DOWN,
        /** A response arrived after its request had already timed out. */
        LATE_RESPONSE,
        /** A datagram arrived that matches no outstanding request. */
        UNSOLICITED_RESPONSE,
        /** A datagram could not be decoded and was dropped. */
        MALFORMED_DATAGRAM
    }
}
