package com.questrail.mcumgr.observability;

import com.questrail.mcumgr.model.McuMgrGroup;
import com.questrail.mcumgr.model.McuMgrOperation;
import com.questrail.mcumgr.model.McuMgrVersion;

import java.time.Instant;

/**
 * A request handed to the transport.
 */
public record McuMgrRequestEvent(
        Instant timestamp,
        McuMgrVersion version,
        McuMgrGroup group,
        McuMgrOperation operation,
        int sequenceNumber,
        int commandId,
        int packetLength
) {
}
